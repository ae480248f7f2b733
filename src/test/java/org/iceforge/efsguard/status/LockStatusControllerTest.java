package org.iceforge.efsguard.status;

import org.iceforge.efsguard.lock.LockStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class LockStatusControllerTest {

    private final LockStatusService svc = Mockito.mock(LockStatusService.class);
    private MockMvc mvc;

    @BeforeEach
    void setup() {
        mvc = MockMvcBuilders.standaloneSetup(new LockStatusController(svc)).build();
    }

    @Test
    void reportsCurrentLock() throws Exception {
        when(svc.current()).thenReturn(new LockStatus("/mnt/efs/app.db", "database#/mnt/efs/app.db", "dynamodb",
                LockStatus.State.HELD, "owner-1", Instant.ofEpochSecond(1010), Instant.ofEpochSecond(1000), false));

        mvc.perform(get("/api/lock"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resourceKey").value("database#/mnt/efs/app.db"))
                .andExpect(jsonPath("$.state").value("HELD"))
                .andExpect(jsonPath("$.lockId").value("owner-1"))
                .andExpect(jsonPath("$.journalPresent").value(false));
    }

    @Test
    void storeFailureIsServiceUnavailable() throws Exception {
        when(svc.current()).thenThrow(new LockStoreException("GetItem failed", null, true));

        mvc.perform(get("/api/lock"))
                .andExpect(status().isServiceUnavailable());
    }
}
