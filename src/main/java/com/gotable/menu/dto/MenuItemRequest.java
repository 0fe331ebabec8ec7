package com.gotable.menu.dto;

import com.gotable.common.exception.BusinessException;
import com.gotable.common.exception.ErrorCode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 요청된 (메뉴, 수량) 한 쌍. 결제 의도 생성과 예약 생성에서 함께 쓴다.
 */
public record MenuItemRequest(
        @NotNull
        Long menuId,

        @NotNull @Positive
        Integer quantity
) {

    /**
     * 같은 메뉴 ID를 하나로 합치고 수량을 더한다. 처음 등장한 순서를 유지한다.
     * 병합 전에 모든 항목을 먼저 검사한다.
     *
     * @throws BusinessException INVALID_INPUT - ID 누락, 0 이하 수량,
     *                           합산 수량이 {@code int} 범위를 넘는 경우
     */
    public static List<MenuItemRequest> mergeDuplicates(List<MenuItemRequest> items) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        for (MenuItemRequest item : items) {
            if (item == null || item.menuId() == null) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "menu_id is required");
            }
            if (item.quantity() == null || item.quantity() <= 0) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        "Quantity must be positive: menuId=" + item.menuId());
            }
        }

        Map<Long, Integer> merged = new LinkedHashMap<>();
        try {
            items.forEach(item -> merged.merge(item.menuId(), item.quantity(), Math::addExact));
        } catch (ArithmeticException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Merged quantity is too large");
        }
        return merged.entrySet().stream()
                .map(entry -> new MenuItemRequest(entry.getKey(), entry.getValue()))
                .toList();
    }
}
