package io.github.cyfko.exprfilter.sample;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.logging.Logger;

/**
 * Seeds the sample database on startup, then logs the result of every demo filter.
 * Disabled with {@code exprfilter.sample.run-demo=false}.
 */
@Component
@ConditionalOnProperty(name = "exprfilter.sample.run-demo", havingValue = "true", matchIfMissing = true)
public class SampleRunner implements CommandLineRunner {

    private static final Logger logger = Logger.getLogger(SampleRunner.class.getName());

    @PersistenceContext
    private EntityManager em;

    private final SampleQueries queries;

    public SampleRunner(SampleQueries queries) {
        this.queries = queries;
    }

    @Override
    @Transactional
    public void run(String... args) {
        LocalDateTime now = LocalDateTime.now();
        SampleData.seed(em, now);
        em.flush();
        em.clear();

        log("John OR Onion", queries.johnOrOnion());
        log("John AND Onion", queries.johnAndOnion());
        log("Placed in the last 60 hours", queries.placedBetween(now.minusHours(60), now));
        log("Customer first name or product containing 'e'", queries.mentioning("e"));
    }

    private static void log(String title, List<Order> orders) {
        logger.info(() -> String.format("%s: %d order(s) %s", title, orders.size(), orders));
    }
}
