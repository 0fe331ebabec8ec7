package com.gotable.menu.service;

import com.gotable.common.exception.BusinessException;
import com.gotable.common.exception.ErrorCode;
import com.gotable.menu.dto.MenuItemRequest;
import com.gotable.menu.entity.Menu;
import com.gotable.menu.repository.MenuRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * 메뉴 카탈로그 조회와 가격 계산.
 *
 * <p>가격은 항상 현재 카탈로그 기준으로 서버에서 다시 계산한다.
 * 클라이언트가 보낸 금액은 신뢰하지 않는다.</p>
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MenuService {

    private final MenuRepository menuRepository;

    /** 판매 중인 메뉴 목록 (ID 오름차순) */
    public List<Menu> getAvailableMenus() {
        return menuRepository.findByAvailableTrueOrderByIdAsc();
    }

    /** 메뉴 단건 조회 - 없으면 UNKNOWN_MENU */
    public Menu getMenu(Long menuId) {
        return menuRepository.findById(menuId)
                .orElseThrow(() -> new BusinessException(ErrorCode.UNKNOWN_MENU,
                        "Menu does not exist: id=" + menuId));
    }

    /**
     * 현재 카탈로그 가격으로 메뉴 선택을 견적한다.
     *
     * @param requireAvailable 판매 중지 메뉴를 거절할지 여부. 이미 결제된 예약을
     *                         기록할 때는 결제 시점에 가격이 확정되었으므로 false를 넘긴다.
     */
    public MenuQuote quote(List<MenuItemRequest> items, boolean requireAvailable) {
        List<MenuQuote.Line> lines = new ArrayList<>();
        long total = 0;

        for (MenuItemRequest item : items) {
            if (item == null || item.menuId() == null) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "menu_id is required");
            }
            if (item.quantity() == null || item.quantity() <= 0) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        "Quantity must be positive: menuId=" + item.menuId());
            }

            Menu menu = getMenu(item.menuId());
            if (requireAvailable && !menu.isAvailable()) {
                throw new BusinessException(ErrorCode.MENU_UNAVAILABLE,
                        "Menu is currently unavailable: " + menu.getName());
            }

            long subtotal = MenuPriceCalculator.subtotal(menu.getPrice(), item.quantity());
            total = MenuPriceCalculator.add(total, subtotal);
            lines.add(new MenuQuote.Line(menu, item.quantity(), subtotal));
        }

        return new MenuQuote(List.copyOf(lines), total);
    }
}
