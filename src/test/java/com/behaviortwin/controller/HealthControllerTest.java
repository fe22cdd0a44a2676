package com.behaviortwin.controller;

import com.behaviortwin.dto.AvailabilityResponse;
import com.behaviortwin.service.HealthService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock HealthService healthService;
    @InjectMocks HealthController controller;

    @Test
    void ready_dataUnavailable_returns503() {
        when(healthService.readiness()).thenReturn(AvailabilityResponse.builder()
            .status(HealthService.NOT_READY).message("Data sources not available").build());

        ResponseEntity<AvailabilityResponse> resp = controller.ready();

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(resp.getBody().getStatus()).isEqualTo("not_ready");
    }

    @Test
    void ready_dataAvailable_returns200() {
        when(healthService.readiness()).thenReturn(AvailabilityResponse.builder()
            .status(HealthService.READY).message("Service is ready").build());

        assertThat(controller.ready().getStatusCode()).isEqualTo(HttpStatus.OK);
    }
}
