package com.eatsential.eatsential_api.catalog.repository;

import com.eatsential.eatsential_api.catalog.entity.MenuItem;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface MenuItemRepository extends JpaRepository<MenuItem, Long> {

    // 활성 식당의 메뉴만, id 순서가 카탈로그 순서가 된다.
    @EntityGraph(attributePaths = {"restaurant", "allergens", "dietTags"})
    @Query("select m from MenuItem m where m.restaurant.active = true order by m.id asc")
    List<MenuItem> findAllOfActiveRestaurants();
}
