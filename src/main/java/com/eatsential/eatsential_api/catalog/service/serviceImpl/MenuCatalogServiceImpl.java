package com.eatsential.eatsential_api.catalog.service.serviceImpl;

import com.eatsential.eatsential_api.catalog.model.CatalogItem;
import com.eatsential.eatsential_api.catalog.repository.MenuItemRepository;
import com.eatsential.eatsential_api.catalog.service.MenuCatalogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MenuCatalogServiceImpl implements MenuCatalogService {

    private final MenuItemRepository menuItemRepository;

    @Override
    public List<CatalogItem> loadActiveItems() {
        List<CatalogItem> items = menuItemRepository.findAllOfActiveRestaurants().stream()
                .map(CatalogItem::from)
                .toList();
        log.debug("[Catalog] loaded active menu items. size={}", items.size());
        return items;
    }
}
