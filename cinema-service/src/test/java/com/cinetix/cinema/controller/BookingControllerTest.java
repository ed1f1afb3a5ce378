package com.cinetix.cinema.controller;

import com.cinetix.cinema.domain.BookingStatus;
import com.cinetix.cinema.dto.response.BookingResponse;
import com.cinetix.cinema.service.BookingService;
import com.cinetix.common.exception.BusinessException;
import com.cinetix.common.exception.GlobalExceptionHandler;
import com.cinetix.common.response.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class BookingControllerTest {

    @Mock
    private BookingService bookingService;

    @InjectMocks
    private BookingController bookingController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(bookingController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void reserve_returnsCreatedEnvelope() throws Exception {
        when(bookingService.reserve(10L, 100L, "A1")).thenReturn(new BookingResponse(
                1L, 10L, 100L, "A1", BookingStatus.ACTIVE, LocalDateTime.of(2025, 6, 1, 12, 0), null, null));

        mockMvc.perform(post("/api/v1/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scheduleId\":10,\"accountId\":100,\"seatCode\":\"A1\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.seatCode").value("A1"))
                .andExpect(jsonPath("$.data.status").value("ACTIVE"));
    }

    @Test
    void reserve_seatTaken_mapsToConflict() throws Exception {
        when(bookingService.reserve(10L, 100L, "A1"))
                .thenThrow(new BusinessException(ErrorCode.SEAT_TAKEN, "Seat A1 is already booked for schedule 10"));

        mockMvc.perform(post("/api/v1/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scheduleId\":10,\"accountId\":100,\"seatCode\":\"A1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("B001"));
    }

    @Test
    void reserve_blankSeat_rejectedBeforeService() throws Exception {
        mockMvc.perform(post("/api/v1/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scheduleId\":10,\"accountId\":100,\"seatCode\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("C001"));

        verifyNoInteractions(bookingService);
    }

    @Test
    void getBooking_notFound() throws Exception {
        when(bookingService.getBooking(anyLong()))
                .thenThrow(new BusinessException(ErrorCode.BOOKING_NOT_FOUND, "Booking not found: 9"));

        mockMvc.perform(get("/api/v1/bookings/9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.message").value("Booking not found: 9"));
    }

    @Test
    void getBookings_withAccountFilter_usesAccountQuery() throws Exception {
        when(bookingService.getAccountBookings(100L)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/bookings").param("accountId", "100"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());

        verify(bookingService).getAccountBookings(100L);
    }

    @Test
    void cancel_returnsCancelledBooking() throws Exception {
        when(bookingService.cancel(any())).thenReturn(new BookingResponse(
                1L, 10L, 100L, "A1", BookingStatus.CANCELLED, LocalDateTime.of(2025, 6, 1, 12, 0), null, null));

        mockMvc.perform(post("/api/v1/bookings/1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("CANCELLED"));
    }
}
