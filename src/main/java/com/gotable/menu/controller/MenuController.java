package com.gotable.menu.controller;

import com.gotable.common.dto.ApiResponse;
import com.gotable.menu.dto.MenuResponse;
import com.gotable.menu.service.MenuService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 메뉴 API 컨트롤러 - 인증 없이 조회 가능.
 *
 * <h3>API 목록</h3>
 * <ul>
 *   <li>GET /api/menus - 판매 중인 메뉴 목록 (ID 순)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/menus")
@RequiredArgsConstructor
public class MenuController {

    private final MenuService menuService;

    /** 판매 중인 메뉴 목록 조회 */
    @GetMapping
    public ApiResponse<List<MenuResponse>> getMenus() {
        return ApiResponse.ok(menuService.getAvailableMenus().stream()
                .map(MenuResponse::from)
                .toList());
    }
}
