package com.spa.aggregator.product.model;

public record CouponScheduleItem(Field<String> date, Field<Double> amount, Field<String> currency) {
    public CouponScheduleItem {
        date = date == null ? Field.empty() : date;
        amount = amount == null ? Field.empty() : amount;
        currency = currency == null ? Field.empty() : currency;
    }
}
