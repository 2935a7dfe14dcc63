package com.spring.fateweaver.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();
    private HttpServletRequest request;

    @BeforeEach
    void setUp() {
        request = mock(HttpServletRequest.class);
        when(request.getRequestURI()).thenReturn("/api/campaigns/c1/turns");
    }

    @Test
    void access_denied_is_reported_as_forbidden() {
        ResponseEntity<ApiErrorResponse> response =
            handler.handleAccessDenied(new AccessDeniedException("not your campaign"), request);

        assertThat(response.getStatusCode().value()).isEqualTo(403);
        assertThat(response.getBody().code()).isEqualTo(ErrorCode.FORBIDDEN);
        assertThat(response.getBody().path()).isEqualTo("/api/campaigns/c1/turns");
    }

    @Test
    void stale_campaign_is_reported_as_a_conflict() {
        ResponseEntity<ApiErrorResponse> response =
            handler.handleBusiness(new StaleCampaignException("c1", 3L, 4L), request);

        assertThat(response.getStatusCode().value()).isEqualTo(409);
        assertThat(response.getBody().code()).isEqualTo(ErrorCode.TURN_IN_PROGRESS);
        assertThat(response.getBody().message()).contains("NOT charged");
    }
}
