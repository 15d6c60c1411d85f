package io.gearledger.model;

public record ResultRecord(
        long id,
        String artikul,
        String client,
        int quantity,
        double weight,
        String brand,
        String description,
        double salePrice,
        double totalPrice,
        String lastUpdated,
        String createdAt
) {
}
