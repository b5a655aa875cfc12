package com.github.salilvnair.orderbot.recommendation;

import com.github.salilvnair.orderbot.support.InMemoryOrderingStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.salilvnair.orderbot.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;

class DefaultRecommendationProviderTest {

    private final InMemoryOrderingStore store = new InMemoryOrderingStore();
    private final DefaultRecommendationProvider provider = new DefaultRecommendationProvider(store);

    @Test
    void pizzaWithoutDrinkGetsDrinks() {
        store.addToCart(USER_ID, store.size(MARGHERITA, SIZE_L).id(), 1);

        List<Recommendation> picks = provider.getRecommendations(USER_ID, store.getCart(USER_ID), 2);

        assertEquals(List.of(MANGO_JUICE, COLA), names(picks));
        assertEquals("🥤 Pair it", picks.get(0).badge());
    }

    @Test
    void pizzaWithDrinkGetsFriesThenFeatured() {
        store.addToCart(USER_ID, store.size(MARGHERITA, SIZE_L).id(), 1);
        store.addToCart(USER_ID, store.size(COLA, SIZE_REG).id(), 1);

        List<Recommendation> picks = provider.getRecommendations(USER_ID, store.getCart(USER_ID), 3);

        assertEquals(List.of(FRIES, "Vegetables Pizza", "Mushroom Pizza"), names(picks));
        assertEquals("⭐ Featured", picks.get(1).badge());
    }

    @Test
    void pastOrdersDriveSimilarItems() {
        store.addToCart(USER_ID, store.size("Salami Pizza", SIZE_S).id(), 2);
        store.checkout(USER_ID);

        List<Recommendation> picks = provider.getRecommendations(USER_ID, store.getCart(USER_ID), 2);

        assertEquals(List.of(MARGHERITA, "Vegetables Pizza"), names(picks));
        assertEquals("Similar to your favorite Salami Pizza", picks.get(0).reason());
    }

    @Test
    void otherUsersOrdersCountAsPopular() {
        store.addToCart(USER_ID, store.size("Salami Pizza", SIZE_S).id(), 2);
        store.checkout(USER_ID);

        List<Recommendation> picks = provider.getRecommendations(OTHER_USER_ID, store.getCart(OTHER_USER_ID), 1);

        assertEquals(List.of("Salami Pizza"), names(picks));
        assertEquals("🔥 Popular", picks.get(0).badge());
    }

    @Test
    void neverRecommendsZeroItems() {
        assertTrue(provider.getRecommendations(USER_ID, store.getCart(USER_ID), 0).isEmpty());
    }

    @Test
    void formatsSingleAndMultiSizePicks() {
        store.addToCart(USER_ID, store.size(MARGHERITA, SIZE_L).id(), 1);
        store.addToCart(USER_ID, store.size(COLA, SIZE_REG).id(), 1);
        List<Recommendation> picks = provider.getRecommendations(USER_ID, store.getCart(USER_ID), 2);

        String text = provider.formatRecommendationsText(picks, "en");

        assertEquals("🎯 Recommendations for you:\n\n"
                + "🍟 Add on Fries\n   Complete your meal!\n   50 EGP\n\n"
                + "⭐ Featured Vegetables Pizza\n   Great choice\n   S(85 EGP), M(105 EGP), L(145 EGP)\n\n", text);
        assertEquals("", provider.formatRecommendationsText(List.of(), "en"));
    }

    private List<String> names(List<Recommendation> picks) {
        return picks.stream().map(Recommendation::name).toList();
    }
}
