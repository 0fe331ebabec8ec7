package com.gotable.menu.service;

import com.gotable.common.exception.BusinessException;
import com.gotable.common.exception.ErrorCode;

/**
 * 오버플로를 검사하는 금액 계산. 범위를 넘으면 INVALID_INPUT.
 */
public final class MenuPriceCalculator {

    private MenuPriceCalculator() {}

    public static long subtotal(int price, int quantity) {
        try {
            return Math.multiplyExact((long) price, (long) quantity);
        } catch (ArithmeticException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Amount is out of range");
        }
    }

    public static long add(long total, long subtotal) {
        try {
            return Math.addExact(total, subtotal);
        } catch (ArithmeticException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Amount is out of range");
        }
    }
}
