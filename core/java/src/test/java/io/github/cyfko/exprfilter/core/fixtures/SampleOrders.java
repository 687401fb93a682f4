package io.github.cyfko.exprfilter.core.fixtures;

import java.time.LocalDateTime;
import java.util.List;

/**
 * The four sample orders of three customers, dated relative to {@code now}.
 */
public final class SampleOrders {

    private SampleOrders() {}

    public static List<Order> create(LocalDateTime now) {
        Customer john = new Customer("John", "Doe", 15);
        Customer petr = new Customer("Petr", "Petrov", 30);
        Customer pettr = new Customer("Pettr", "Pettrov", 31);
        return List.of(
                new Order("1", "Tomato", now.minusDays(3), john),
                new Order("1", "Onion", now.minusDays(2), john),
                new Order("1", "Banana", now.minusDays(1), petr),
                new Order("1", "Chery", now, pettr));
    }
}
