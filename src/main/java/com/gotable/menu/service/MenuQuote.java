package com.gotable.menu.service;

import com.gotable.menu.entity.Menu;

import java.util.List;

/**
 * 조회 시점의 가격으로 계산한 메뉴 선택 견적 (라인별 소계 + 합계).
 */
public record MenuQuote(List<Line> lines, long total) {

    public record Line(Menu menu, int quantity, long subtotal) {}
}
