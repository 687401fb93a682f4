package io.github.cyfko.exprfilter.jpa;

import io.github.cyfko.exprfilter.jpa.entities.Address;
import io.github.cyfko.exprfilter.jpa.entities.Product;
import io.github.cyfko.exprfilter.jpa.entities.Supplier;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;

import java.time.LocalDate;

/**
 * Seeds the product catalog shared by the JPA tests.
 */
final class TestCatalog {

    private TestCatalog() {}

    static void seed(EntityManagerFactory emf) {
        EntityManager em = emf.createEntityManager();
        em.getTransaction().begin();

        Supplier acme = new Supplier("Acme", new Address("Paris", "1 Rue de la Paix"));
        Supplier globex = new Supplier("Globex", new Address("Berlin", null));
        em.persist(acme);
        em.persist(globex);

        em.persist(new Product("Acme Bolt", 10, LocalDate.of(2024, 1, 10), true, acme));
        em.persist(new Product("Bolt", null, LocalDate.of(2024, 3, 1), false, null));
        em.persist(new Product("100% Cotton", 5, LocalDate.of(2023, 12, 31), true, globex));
        em.persist(new Product("snake_case", 0, LocalDate.of(2024, 6, 15), false, globex));
        em.persist(new Product("Back\\slash", 20, LocalDate.of(2024, 2, 29), true, acme));
        em.persist(new Product("Widget", 3, LocalDate.of(2024, 1, 1), true, acme));

        em.getTransaction().commit();
        em.close();
    }
}
