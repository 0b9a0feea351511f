package com.demo.coffeeshop.order;

public enum OrderStatus {
    NEW, SUBMITTED, DELIVERED, COMPLETED
}
