package com.github.salilvnair.orderbot.store.jpa;

import com.github.salilvnair.orderbot.engine.exception.DialogueEngineErrorCode;
import com.github.salilvnair.orderbot.engine.exception.DialogueEngineException;
import com.github.salilvnair.orderbot.entity.ObMenuItem;
import com.github.salilvnair.orderbot.entity.ObMenuSize;
import com.github.salilvnair.orderbot.repo.MenuItemRepository;
import com.github.salilvnair.orderbot.repo.MenuSizeRepository;
import com.github.salilvnair.orderbot.store.MenuCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "orderbot.menu", name = "seed", havingValue = "true", matchIfMissing = true)
public class MenuSeeder implements ApplicationRunner {

    private final MenuItemRepository menuItemRepository;
    private final MenuSizeRepository menuSizeRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (menuItemRepository.count() > 0) {
            log.debug("Menu already present, skipping seed");
            return;
        }
        try {
            for (MenuCatalog.Entry entry : MenuCatalog.STANDARD) {
                ObMenuItem item = menuItemRepository.save(ObMenuItem.builder()
                        .name(entry.name())
                        .category(entry.category())
                        .available(true)
                        .build());
                entry.prices().forEach((size, price) -> menuSizeRepository.save(ObMenuSize.builder()
                        .itemId(item.getItemId())
                        .sizeCode(size)
                        .price(price)
                        .available(true)
                        .build()));
            }
        } catch (RuntimeException e) {
            throw new DialogueEngineException(DialogueEngineErrorCode.MENU_SEED_FAILED,
                    "Failed to seed menu: " + e.getMessage(), e);
        }
        log.info("Seeded menu with {} items", MenuCatalog.STANDARD.size());
    }
}
