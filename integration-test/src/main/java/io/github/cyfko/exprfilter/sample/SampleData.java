package io.github.cyfko.exprfilter.sample;

import io.github.cyfko.exprfilter.jpa.JpaQueryable;
import jakarta.persistence.EntityManager;

import java.time.LocalDateTime;
import java.util.logging.Logger;

/**
 * Seed data of the sample: three customers and four orders dated relative to {@code now}.
 *
 * <table>
 *   <caption>Seeded orders</caption>
 *   <tr><th>Product</th><th>Customer</th><th>Placed</th></tr>
 *   <tr><td>Tomato</td><td>John Doe (15)</td><td>now - 3 days</td></tr>
 *   <tr><td>Onion</td><td>John Doe (15)</td><td>now - 2 days</td></tr>
 *   <tr><td>Banana</td><td>Petr Petrov (30)</td><td>now - 1 day</td></tr>
 *   <tr><td>Chery</td><td>Pettr Pettrov (31)</td><td>now</td></tr>
 * </table>
 */
public final class SampleData {

    private static final Logger logger = Logger.getLogger(SampleData.class.getName());

    private SampleData() {
        throw new UnsupportedOperationException("SampleData is a utility class and cannot be instantiated");
    }

    /**
     * Inserts the sample rows unless orders already exist. Must run inside a transaction.
     *
     * @return {@code true} if rows were inserted
     */
    public static boolean seed(EntityManager em, LocalDateTime now) {
        if (JpaQueryable.from(em, Order.class).count() > 0) {
            logger.info("Sample data already present, seeding skipped");
            return false;
        }

        Customer john = new Customer("John", "Doe", 15);
        Customer petr = new Customer("Petr", "Petrov", 30);
        Customer pettr = new Customer("Pettr", "Pettrov", 31);
        em.persist(john);
        em.persist(petr);
        em.persist(pettr);

        em.persist(new Order("1", "Tomato", now.minusDays(3), john));
        em.persist(new Order("1", "Onion", now.minusDays(2), john));
        em.persist(new Order("1", "Banana", now.minusDays(1), petr));
        em.persist(new Order("1", "Chery", now, pettr));

        logger.info("Sample data seeded: 3 customers, 4 orders");
        return true;
    }
}
