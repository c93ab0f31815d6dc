package com.demo.app;

public final class DemoTopics {
    private DemoTopics() {}

    public static final String ORDERS = "orders";
    public static final String ORDERS_DLQ = "orders.DLQ";
    public static final String ORDER_CREATED = "order.created";
}
