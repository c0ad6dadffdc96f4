package com.eatsential.eatsential_api.catalog.service;

import com.eatsential.eatsential_api.catalog.model.CatalogItem;

import java.util.List;

public interface MenuCatalogService {

    /**
     * 활성 식당의 전체 메뉴를 카탈로그 순서(메뉴 id 오름차순)로 반환한다.
     * 저장소 장애는 {@link org.springframework.dao.DataAccessException}으로 그대로 전파된다.
     */
    List<CatalogItem> loadActiveItems();
}
