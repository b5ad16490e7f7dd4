package com.fintech.analytics.api;

import com.fintech.analytics.domain.model.TopCustomer;
import com.fintech.analytics.domain.service.CustomerService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CustomerController.class)
@ActiveProfiles("test")
class CustomerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CustomerService customerService;

    @Test
    void top_defaultsToTen() throws Exception {
        when(customerService.top(10)).thenReturn(List.of(TopCustomer.builder()
                .customerId("C001")
                .transactionCount(2)
                .totalAmount(new BigDecimal("300.00"))
                .build()));

        mockMvc.perform(get("/api/customers/Ranked/top"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].customer_id").value("C001"))
                .andExpect(jsonPath("$[0].transaction_count").value(2))
                .andExpect(jsonPath("$[0].total_amount").value(300.00));
    }

    @Test
    void top_outOfRange_isRejected() throws Exception {
        mockMvc.perform(get("/api/customers/Ranked/top").param("n", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_FAILED"));

        mockMvc.perform(get("/api/customers/Ranked/top").param("n", "1001"))
                .andExpect(status().isBadRequest());

        verify(customerService, never()).top(anyInt());
    }
}
