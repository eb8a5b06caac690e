package com.watchledger.analytics.contact;

public record FavoriteBrand(String brand, int count) {

    public static final FavoriteBrand NONE = new FavoriteBrand("N/A", 0);
}
