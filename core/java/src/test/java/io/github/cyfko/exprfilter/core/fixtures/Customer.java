package io.github.cyfko.exprfilter.core.fixtures;

/**
 * Plain customer object for in-memory filtering tests.
 */
public class Customer {
    private final String firstName;
    private final String lastName;
    private final int age;

    public Customer(String firstName, String lastName, int age) {
        this.firstName = firstName;
        this.lastName = lastName;
        this.age = age;
    }

    public String getFirstName() { return firstName; }
    public String getLastName() { return lastName; }
    public int getAge() { return age; }

    @Override
    public String toString() {
        return firstName + " " + lastName;
    }
}
