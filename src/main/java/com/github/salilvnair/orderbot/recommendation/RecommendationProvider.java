package com.github.salilvnair.orderbot.recommendation;

import com.github.salilvnair.orderbot.store.model.CartSnapshot;

import java.util.List;

public interface RecommendationProvider {

    List<Recommendation> getRecommendations(Long userId, CartSnapshot cart, int maxItems);

    /** Chat text for the given picks; empty when there are none. */
    String formatRecommendationsText(List<Recommendation> recommendations, String language);
}
