package com.github.salilvnair.orderbot.store.model;

import java.util.List;

public record UserProfile(Long id, String name, int orderCount, List<String> favoriteItems) {

    public UserProfile {
        favoriteItems = favoriteItems == null ? List.of() : List.copyOf(favoriteItems);
    }
}
