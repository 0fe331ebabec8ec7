package com.gotable.payment.controller;

import com.gotable.common.exception.BusinessException;
import com.gotable.common.exception.ErrorCode;
import com.gotable.menu.dto.MenuItemRequest;
import com.gotable.payment.dto.CreatePaymentIntentResponse;
import com.gotable.payment.dto.PublishableKeyResponse;
import com.gotable.payment.service.PaymentService;
import com.gotable.support.MockMvcSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class PaymentControllerTest {

    @Mock
    private PaymentService paymentService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcSupport.standalone(new PaymentController(paymentService));
    }

    @Test
    @DisplayName("결제 의도 생성 - 본문은 메뉴 배열")
    void createIntent() throws Exception {
        given(paymentService.createPaymentIntent(1L, List.of(new MenuItemRequest(1L, 2))))
                .willReturn(new CreatePaymentIntentResponse("pi_1_secret", "pi_1", 1700L));

        mockMvc.perform(post("/api/payments/create-intent")
                        .requestAttr("userId", 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"menu_id\": 1, \"quantity\": 2}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.client_secret").value("pi_1_secret"))
                .andExpect(jsonPath("$.data.payment_intent_id").value("pi_1"))
                .andExpect(jsonPath("$.data.amount").value(1700));
    }

    @Test
    @DisplayName("빈 배열은 400 no_items_selected")
    void createIntent_Empty() throws Exception {
        given(paymentService.createPaymentIntent(1L, List.of()))
                .willThrow(new BusinessException(ErrorCode.NO_ITEMS_SELECTED));

        mockMvc.perform(post("/api/payments/create-intent")
                        .requestAttr("userId", 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("https://gotable.dev/errors/no_items_selected"));
    }

    @Test
    @DisplayName("이미 환불된 결제는 409")
    void refund_AlreadyRefunded() throws Exception {
        given(paymentService.refundPayment(1L, "pi_done"))
                .willThrow(new BusinessException(ErrorCode.ALREADY_REFUNDED));

        mockMvc.perform(post("/api/payments/refund/pi_done").requestAttr("userId", 1L))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.type").value("https://gotable.dev/errors/already_refunded"));
    }

    @Test
    @DisplayName("환불은 인증 필요")
    void refund_Unauthenticated() throws Exception {
        mockMvc.perform(post("/api/payments/refund/pi_x"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("공개 키는 인증 없이 조회")
    void publishableKey() throws Exception {
        given(paymentService.publishableKey()).willReturn(new PublishableKeyResponse("pk_test_mock"));

        mockMvc.perform(get("/api/stripe/publishable-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.publishable_key").value("pk_test_mock"));
    }

    @Test
    @DisplayName("공개 키 미설정은 500 gateway_not_configured")
    void publishableKey_NotConfigured() throws Exception {
        given(paymentService.publishableKey()).willThrow(new BusinessException(ErrorCode.GATEWAY_NOT_CONFIGURED));

        mockMvc.perform(get("/api/stripe/publishable-key"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.type").value("https://gotable.dev/errors/gateway_not_configured"));
    }
}
