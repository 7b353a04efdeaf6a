package com.attendance.tracker.test.web;

import com.attendance.tracker.common.exception.ConflictException;
import com.attendance.tracker.common.exception.ValidationException;
import com.attendance.tracker.core.Prompt;
import com.attendance.tracker.enums.AttendanceStatus;
import com.attendance.tracker.enums.CollectionState;
import com.attendance.tracker.model.dto.AbsenceResult;
import com.attendance.tracker.service.attendance.AbsenceService;
import com.attendance.tracker.service.collection.AttendanceCollectionService;
import com.attendance.tracker.web.AttendanceController;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AttendanceController.class, properties = "attendance.admin.id=" + WebTestConfig.ADMIN)
@Import(WebTestConfig.class)
class AttendanceControllerTest {

    static final LocalDate DAY = LocalDate.of(2025, 7, 15);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AttendanceCollectionService collectionService;
    @MockBean
    private AbsenceService absenceService;

    private static Prompt awaiting(long id, String name, int position) {
        return Prompt.builder()
                .state(CollectionState.AWAITING_DECISION)
                .message("Employee #" + position + ": " + name)
                .choices(List.of(AttendanceStatus.PRESENT, AttendanceStatus.ABSENT))
                .employeeId(id).employeeName(name).position(position).total(2)
                .sessionDate(DAY)
                .build();
    }

    @Test
    void startWithExplicitDate() throws Exception {
        when(collectionService.start(WebTestConfig.ADMIN, DAY)).thenReturn(awaiting(1, "Asha", 1));

        mockMvc.perform(post("/api/attendance/sessions")
                        .header("X-Admin-Id", WebTestConfig.ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"date\":\"15-07-2025\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("AWAITING_DECISION"))
                .andExpect(jsonPath("$.employeeName").value("Asha"))
                .andExpect(jsonPath("$.choices[0]").value("PRESENT"))
                .andExpect(jsonPath("$.sessionDate").value("15-07-2025"));
    }

    @Test
    void startWithoutBodyUsesToday() throws Exception {
        when(collectionService.start(WebTestConfig.ADMIN, null)).thenReturn(awaiting(1, "Asha", 1));

        mockMvc.perform(post("/api/attendance/sessions").header("X-Admin-Id", WebTestConfig.ADMIN))
                .andExpect(status().isOk());

        verify(collectionService).start(WebTestConfig.ADMIN, null);
    }

    @Test
    void secondStartIsConflict() throws Exception {
        when(collectionService.start(WebTestConfig.ADMIN, null))
                .thenThrow(new ConflictException("Attendance collection already in progress"));

        mockMvc.perform(post("/api/attendance/sessions").header("X-Admin-Id", WebTestConfig.ADMIN))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ERR-CONFLICT"));
    }

    @Test
    void absentDecisionCarriesEmployeeId() throws Exception {
        when(collectionService.decide(WebTestConfig.ADMIN, AttendanceStatus.ABSENT, 1L)).thenReturn(Prompt.builder()
                .state(CollectionState.AWAITING_REASON).employeeId(1L).employeeName("Asha").sessionDate(DAY).build());

        mockMvc.perform(post("/api/attendance/sessions/current/decision")
                        .header("X-Admin-Id", WebTestConfig.ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\":\"ABSENT\",\"employeeId\":1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("AWAITING_REASON"))
                .andExpect(jsonPath("$.choices").isEmpty());
    }

    @Test
    void missingDecisionIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/attendance/sessions/current/decision")
                        .header("X-Admin-Id", WebTestConfig.ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(collectionService);
    }

    @Test
    void reasonAdvances() throws Exception {
        when(collectionService.reason(WebTestConfig.ADMIN, "Sick")).thenReturn(awaiting(2, "Ravi", 2));

        mockMvc.perform(post("/api/attendance/sessions/current/reason")
                        .header("X-Admin-Id", WebTestConfig.ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"Sick\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.position").value(2));
    }

    @Test
    void multiDayAbsence() throws Exception {
        LocalDate end = LocalDate.of(2025, 7, 18);
        when(absenceService.recordAbsence(1L, DAY, end, "Vacation")).thenReturn(new AbsenceResult(1L, "Asha", DAY, end, "Vacation",
                List.of("15-07-2025", "16-07-2025", "17-07-2025", "18-07-2025"), List.of()));

        mockMvc.perform(post("/api/attendance/absences")
                        .header("X-Admin-Id", WebTestConfig.ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employeeId\":1,\"startDate\":\"15-07-2025\",\"endDate\":\"18-07-2025\",\"reason\":\"Vacation\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.markedDates.length()").value(4))
                .andExpect(jsonPath("$.startDate").value("15-07-2025"));
    }

    @Test
    void badAbsenceDateNeverReachesService() throws Exception {
        mockMvc.perform(post("/api/attendance/absences")
                        .header("X-Admin-Id", WebTestConfig.ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employeeId\":1,\"startDate\":\"2025-07-15\",\"endDate\":\"18-07-2025\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid start date format. Use DD-MM-YYYY"));

        verify(absenceService, never()).recordAbsence(anyLong(), any(), any(), any());
    }

    @Test
    void invertedAbsenceRangeIsBadRequest() throws Exception {
        when(absenceService.recordAbsence(anyLong(), any(), any(), any()))
                .thenThrow(new ValidationException("Start date must be before end date"));

        mockMvc.perform(post("/api/attendance/absences")
                        .header("X-Admin-Id", WebTestConfig.ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employeeId\":1,\"startDate\":\"18-07-2025\",\"endDate\":\"15-07-2025\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Start date must be before end date"));
    }
}
