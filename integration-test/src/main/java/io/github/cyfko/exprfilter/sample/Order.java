package io.github.cyfko.exprfilter.sample;

import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity(name = "CustomerOrder")
@Table(name = "orders")
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 250)
    private String orderNumber;

    @Column(length = 250)
    private String productName;

    private LocalDateTime dateTime;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(nullable = false)
    private Customer customer;

    public Order() {
    }

    public Order(String orderNumber, String productName, LocalDateTime dateTime, Customer customer) {
        this.orderNumber = orderNumber;
        this.productName = productName;
        this.dateTime = dateTime;
        this.customer = customer;
        customer.getOrders().add(this);
    }

    public Long getId() {
        return id;
    }

    public String getOrderNumber() {
        return orderNumber;
    }

    public String getProductName() {
        return productName;
    }

    public LocalDateTime getDateTime() {
        return dateTime;
    }

    public Customer getCustomer() {
        return customer;
    }

    @Override
    public String toString() {
        return productName + " (" + orderNumber + ")";
    }
}
