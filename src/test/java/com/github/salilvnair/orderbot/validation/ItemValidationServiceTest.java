package com.github.salilvnair.orderbot.validation;

import com.github.salilvnair.orderbot.support.InMemoryOrderingStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.salilvnair.orderbot.support.TestConstants.*;
import static org.junit.jupiter.api.Assertions.*;

class ItemValidationServiceTest {

    private final InMemoryOrderingStore store = new InMemoryOrderingStore();
    private final ItemValidationService service = new ItemValidationService(store);

    @Test
    void emptyNameIsRejected() {
        assertEquals(ItemValidation.Status.EMPTY_NAME, service.validateItem("  ").status());
    }

    @Test
    void partialNameResolves() {
        ItemValidation result = service.validateFullItem("margherita", SIZE_L);

        assertTrue(result.valid());
        assertEquals(MARGHERITA, result.item().name());
        assertEquals(SIZE_L, result.size().size());
    }

    @Test
    void missingSizeTakesFirstAvailable() {
        store.disableSize(MARGHERITA, SIZE_S);

        ItemValidation result = service.validateFullItem(MARGHERITA, null);

        assertEquals("M", result.size().size());
    }

    @Test
    void unknownItemOffersUpToThreeSimilarNames() {
        ItemValidation result = service.validateItem("chicken pizza");

        assertEquals(ItemValidation.Status.SIMILAR_FOUND, result.status());
        assertEquals(List.of(MARGHERITA, "Vegetables Pizza", "Mushroom Pizza"), result.similarItems());
        assertEquals(MARGHERITA, result.bestSuggestion());
    }

    @Test
    void nothingSimilarIsNotFound() {
        ItemValidation result = service.validateItem("xy");

        assertEquals(ItemValidation.Status.NOT_FOUND, result.status());
        assertEquals("'xy' not found in menu", result.message());
    }

    @Test
    void disabledSizeIsUnavailable() {
        store.disableSize(MARGHERITA, SIZE_L);

        ItemValidation result = service.validateFullItem(MARGHERITA, SIZE_L);

        assertEquals(ItemValidation.Status.SIZE_UNAVAILABLE, result.status());
        assertEquals("L size for Margherita Pizza is currently unavailable", result.message());
    }

    @Test
    void sizeNotOfferedListsSizes() {
        ItemValidation result = service.validateFullItem(COLA, SIZE_L);

        assertEquals(ItemValidation.Status.SIZE_NOT_OFFERED, result.status());
        assertEquals("Size L not available. Try: REG", result.message());
    }

    @Test
    void sizesTextIncludesPrices() {
        assertEquals("REG (20 EGP)", service.availableSizesText(store.getMenuItem(COLA, true).orElseThrow()));
    }
}
