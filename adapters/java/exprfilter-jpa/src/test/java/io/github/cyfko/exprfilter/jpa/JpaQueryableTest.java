package io.github.cyfko.exprfilter.jpa;

import io.github.cyfko.exprfilter.core.QueryFilters;
import io.github.cyfko.exprfilter.core.expr.FieldAccessor;
import io.github.cyfko.exprfilter.core.expr.PredicateFragment;
import io.github.cyfko.exprfilter.core.spi.Queryable;
import io.github.cyfko.exprfilter.jpa.entities.Product;
import io.github.cyfko.exprfilter.jpa.entities.Supplier;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import org.hibernate.Hibernate;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JpaQueryable - H2")
class JpaQueryableTest {

    private static EntityManagerFactory emf;

    private EntityManager em;

    @BeforeAll
    static void setup() {
        emf = Persistence.createEntityManagerFactory("testPU");
        TestCatalog.seed(emf);
    }

    @AfterAll
    static void teardown() {
        if (emf != null) emf.close();
    }

    @BeforeEach
    void openEntityManager() {
        em = emf.createEntityManager();
    }

    @AfterEach
    void closeEntityManager() {
        em.close();
    }

    private static List<String> names(List<Product> products) {
        return products.stream().map(Product::getName).sorted().collect(Collectors.toList());
    }

    @Test
    @DisplayName("Unrestricted handle should return every entity")
    void unrestricted() {
        JpaQueryable<Product> products = JpaQueryable.from(em, Product.class);

        assertEquals(6, products.toList().size());
        assertEquals(6, products.count());
    }

    @Test
    @DisplayName("Stages should be AND-ed and leave the source handle untouched")
    void stagesAreConjoined() {
        JpaQueryable<Product> source = JpaQueryable.from(em, Product.class);

        JpaQueryable<Product> filtered = source
                .where(PredicateFragment.of("p", p -> p.get("active")))
                .where(PredicateFragment.of("q", q -> q.get("supplier").get("name").eq("Acme")));

        assertEquals(List.of("Acme Bolt", "Back\\slash", "Widget"), names(filtered.toList()));
        assertEquals(3, filtered.count());
        assertTrue(source.getPredicates().isEmpty());
        assertEquals(2, filtered.getPredicates().size());
    }

    @Test
    @DisplayName("Should work behind the QueryFilters surface")
    void queryFilters() {
        Queryable<Product> products = JpaQueryable.from(em, Product.class);

        Queryable<Product> released = QueryFilters.whereDateTimeBetween(products,
                FieldAccessor.path(LocalDate.class, "releaseDate"),
                LocalDate.of(2024, 2, 1), LocalDate.of(2024, 12, 31));
        Queryable<Product> search = QueryFilters.whereAnyPropertyContainsText(released, "o",
                FieldAccessor.path(String.class, "name"),
                FieldAccessor.path(String.class, "supplier.name"));

        assertEquals(List.of("Back\\slash", "Bolt", "snake_case"), names(released.toList()));
        assertEquals(List.of("Bolt", "snake_case"), names(search.toList()));
    }

    @Test
    @DisplayName("include should fetch the association with the entities")
    void includeFetchesAssociation() {
        List<Supplier> withProducts = JpaQueryable.from(em, Supplier.class).include("products").toList();
        em.clear();
        List<Supplier> withoutProducts = JpaQueryable.from(em, Supplier.class).toList();

        assertEquals(2, withProducts.size());
        assertTrue(withProducts.stream().allMatch(s -> Hibernate.isInitialized(s.getProducts())));
        assertTrue(withoutProducts.stream().noneMatch(s -> Hibernate.isInitialized(s.getProducts())));
        assertEquals(5, withProducts.stream().mapToInt(s -> s.getProducts().size()).sum());
    }

    @Test
    @DisplayName("Count should ignore included associations")
    void countIgnoresIncludes() {
        JpaQueryable<Supplier> suppliers = JpaQueryable.from(em, Supplier.class).include("products");

        assertEquals(2, suppliers.count());
        assertEquals(List.of("products"), suppliers.getIncludes());
    }

    @Test
    @DisplayName("Blank include path should be rejected")
    void blankInclude() {
        JpaQueryable<Product> products = JpaQueryable.from(em, Product.class);

        assertThrows(IllegalArgumentException.class, () -> products.include(" "));
        assertThrows(NullPointerException.class, () -> products.include(null));
        assertThrows(NullPointerException.class, () -> products.where(null));
    }

    @Test
    @DisplayName("Resolver of an unrestricted handle should match everything")
    void emptyResolver() {
        JpaQueryable<Product> products = JpaQueryable.from(em, Product.class);

        assertEquals(6, JpaQueryable.from(em, Product.class)
                .where(PredicateFragment.acceptAll())
                .count());
        assertNotNull(products.toResolver());
        assertEquals(Product.class, products.getEntityClass());
    }
}
