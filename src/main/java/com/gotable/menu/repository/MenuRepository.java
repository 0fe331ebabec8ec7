package com.gotable.menu.repository;

import com.gotable.menu.entity.Menu;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface MenuRepository extends JpaRepository<Menu, Long> {

    // 판매 중 메뉴만, ID 오름차순
    List<Menu> findByAvailableTrueOrderByIdAsc();
}
