package com.example.agenda.controllers;

import com.example.agenda.repository.AppointmentRepository;
import com.example.agenda.repository.ScheduleLockRepository;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AppointmentControllerTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private AppointmentRepository appointmentRepository;

    @Autowired
    private ScheduleLockRepository lockRepository;

    @AfterEach
    void cleanUp() {
        appointmentRepository.deleteAll();
        lockRepository.deleteAll();
    }

    @Test
    void shouldCreateAppointmentAndAnswerConflictWith409() throws Exception {
        Number id = create("""
                {"customerRef": 7, "providerId": 1, "start": "2025-03-10T08:00", "durationMinutes": 30, "bookingChannel": "phone"}
                """);

        mvc.perform(post("/appointments").contentType(MediaType.APPLICATION_JSON).content("""
                        {"customerRef": 8, "providerId": 1, "start": "2025-03-10T08:15", "durationMinutes": 30}
                        """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("conflict"))
                .andExpect(jsonPath("$.with.id").value(id.longValue()))
                .andExpect(jsonPath("$.with.start").value("2025-03-10T08:00:00"))
                .andExpect(jsonPath("$.with.end").value("2025-03-10T08:30:00"));
    }

    @Test
    void shouldListSlotsAndCheckConflicts() throws Exception {
        create("""
                {"customerRef": 7, "providerId": 1, "start": "2025-03-10T08:00", "durationMinutes": 30}
                """);

        mvc.perform(get("/appointments/slots")
                        .param("providerId", "1")
                        .param("date", "2025-03-10")
                        .param("durationMinutes", "30")
                        .param("step", "15"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slots[0].start").value("2025-03-10T08:30:00"))
                .andExpect(jsonPath("$.slots[*].start", not(hasItem("2025-03-10T08:15:00"))))
                .andExpect(jsonPath("$.bufferMinutes").value(0));

        mvc.perform(get("/appointments/conflicts")
                        .param("providerId", "1")
                        .param("start", "2025-03-10T08:29")
                        .param("durationMinutes", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conflict").value(true));

        mvc.perform(get("/appointments/conflicts")
                        .param("providerId", "1")
                        .param("start", "2025-03-10T08:30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conflict").value(false));
    }

    @Test
    void shouldChangeStatusUsingLowercaseCodes() throws Exception {
        Number id = create("""
                {"customerRef": 7, "providerId": 1, "start": "2025-03-10T09:00"}
                """);

        mvc.perform(post("/appointments/{id}/status", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"no_show\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("no_show"));

        mvc.perform(get("/appointments")
                        .param("from", "2025-03-10T00:00")
                        .param("to", "2025-03-10T23:59")
                        .param("status", "no_show"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));
    }

    @Test
    void shouldUpdateAndDelete() throws Exception {
        Number id = create("""
                {"customerRef": 7, "providerId": 1, "start": "2025-03-10T10:00", "durationMinutes": 30}
                """);

        mvc.perform(put("/appointments/{id}", id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"start\": \"2025-03-10T10:30\", \"notes\": \"late\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.start").value("2025-03-10T10:30:00"))
                .andExpect(jsonPath("$.end").value("2025-03-10T11:00:00"))
                .andExpect(jsonPath("$.notes").value("late"));

        mvc.perform(delete("/appointments/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.deletedId").value(id.longValue()));

        mvc.perform(delete("/appointments/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void shouldHideOtherProvidersFromScopedCaller() throws Exception {
        Number id = create("""
                {"customerRef": 7, "providerId": 2, "start": "2025-03-10T10:00"}
                """);

        mvc.perform(get("/appointments/{id}", id).header("X-Provider-Scope", "1"))
                .andExpect(status().isNotFound());
        mvc.perform(get("/appointments/{id}", id).header("X-Provider-Scope", "2"))
                .andExpect(status().isOk());
    }

    @Test
    void scopedCallerShouldNotReadOtherProvidersSchedule() throws Exception {
        create("""
                {"customerRef": 7, "providerId": 2, "start": "2025-03-10T10:00"}
                """);

        mvc.perform(get("/appointments/conflicts").header("X-Provider-Scope", "1")
                        .param("providerId", "2").param("start", "2025-03-10T10:00"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation"))
                .andExpect(jsonPath("$.with").doesNotExist());
        mvc.perform(get("/appointments/slots").header("X-Provider-Scope", "1")
                        .param("providerId", "2").param("date", "2025-03-10"))
                .andExpect(status().isBadRequest());

        mvc.perform(get("/appointments/conflicts").header("X-Provider-Scope", "2")
                        .param("providerId", "2").param("start", "2025-03-10T10:00"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conflict").value(true));
        mvc.perform(get("/appointments/slots").header("X-Provider-Scope", "2")
                        .param("providerId", "2").param("date", "2025-03-10"))
                .andExpect(status().isOk());
    }

    @Test
    void shouldAnswer400ForInvalidInput() throws Exception {
        mvc.perform(post("/appointments").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"providerId\": 1, \"start\": \"2025-03-10T08:00\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation"));

        mvc.perform(post("/appointments").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerRef\": 1, \"providerId\": 1, \"start\": \"next monday\"}"))
                .andExpect(status().isBadRequest());

        mvc.perform(get("/appointments/slots")
                        .param("providerId", "1")
                        .param("date", "2025-03-10")
                        .param("step", "0"))
                .andExpect(status().isBadRequest());

        mvc.perform(get("/appointments/slots").param("providerId", "1"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReplaceBusinessHoursAtRuntime() throws Exception {
        mvc.perform(put("/business-hours/{providerId}", 42).contentType(MediaType.APPLICATION_JSON)
                        .content("[\"10:00-11:00\"]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.defaultTemplate").value(false))
                .andExpect(jsonPath("$.windows[0]").value("10:00-11:00"));

        mvc.perform(get("/appointments/slots")
                        .param("providerId", "42")
                        .param("date", "2025-03-10")
                        .param("durationMinutes", "30")
                        .param("step", "30"))
                .andExpect(jsonPath("$.slots", hasSize(2)));

        mvc.perform(delete("/business-hours/{providerId}", 42))
                .andExpect(jsonPath("$.defaultTemplate").value(true))
                .andExpect(jsonPath("$.windows[0]").value("09:00-19:00"));
    }

    private Number create(String body) throws Exception {
        String response = mvc.perform(post("/appointments").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andReturn()
                .getResponse()
                .getContentAsString();
        return JsonPath.read(response, "$.id");
    }
}
