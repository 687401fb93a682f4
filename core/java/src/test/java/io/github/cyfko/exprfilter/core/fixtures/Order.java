package io.github.cyfko.exprfilter.core.fixtures;

import java.time.LocalDateTime;

/**
 * Plain order object for in-memory filtering tests.
 */
public class Order {
    private final String orderNumber;
    private final String productName;
    private final LocalDateTime dateTime;
    private final Customer customer;

    public Order(String orderNumber, String productName, LocalDateTime dateTime, Customer customer) {
        this.orderNumber = orderNumber;
        this.productName = productName;
        this.dateTime = dateTime;
        this.customer = customer;
    }

    public String getOrderNumber() { return orderNumber; }
    public String getProductName() { return productName; }
    public LocalDateTime getDateTime() { return dateTime; }
    public Customer getCustomer() { return customer; }

    @Override
    public String toString() {
        return productName;
    }
}
