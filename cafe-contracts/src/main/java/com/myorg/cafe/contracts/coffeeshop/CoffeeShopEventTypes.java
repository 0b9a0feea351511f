package com.myorg.cafe.contracts.coffeeshop;

public class CoffeeShopEventTypes {
    private CoffeeShopEventTypes() {}

    public static final String ORDER_AGGREGATE = "order";
    public static final String PAYMENT_AGGREGATE = "payment";
    public static final String PRODUCT_AGGREGATE = "product";

    // processing groups share the aggregate names
    public static final String ORDER_GROUP = "order";
    public static final String PAYMENT_GROUP = "payment";
    public static final String PRODUCT_GROUP = "product";

    public static final String ORDER_CREATED = "coffeeshop.order.created";
    public static final String ORDER_ITEM_ADDED = "coffeeshop.order.item-added";
    public static final String ORDER_SUBMITTED = "coffeeshop.order.submitted";
    public static final String ORDER_DELIVERED = "coffeeshop.order.delivered";
    public static final String ORDER_COMPLETED = "coffeeshop.order.completed";
    public static final String ORDER_ITEM_NAME_CORRECTED = "coffeeshop.order.item-name-corrected";

    public static final String PAYMENT_CREATED = "coffeeshop.payment.created";
    public static final String PAYMENT_PROCESSED = "coffeeshop.payment.processed";
    public static final String PAYMENT_FAILED = "coffeeshop.payment.failed";
    public static final String PAYMENT_REFUNDED = "coffeeshop.payment.refunded";
    public static final String PAYMENT_RESET = "coffeeshop.payment.reset";

    public static final String PRODUCT_CREATED = "coffeeshop.product.created";
    public static final String PRODUCT_UPDATED = "coffeeshop.product.updated";
    public static final String PRODUCT_DELETED = "coffeeshop.product.deleted";

    // price fields moved from a bare decimal to {amount, currency}
    public static final int ITEM_ADDED_REVISION = 2;
    public static final int ORDER_SUBMITTED_REVISION = 2;
    // sku became mandatory
    public static final int PRODUCT_CREATED_REVISION = 2;
}
