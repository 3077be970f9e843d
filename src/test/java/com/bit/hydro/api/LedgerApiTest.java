package com.bit.hydro.api;

import com.bit.hydro.LedgerTestSupport;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Slf4j
@AutoConfigureMockMvc
class LedgerApiTest extends LedgerTestSupport {

    private static final long TIME = FIRST_ROUND_START + 1;

    @Autowired
    private MockMvc mockMvc;

    @Test
    void lockVoteAndQueryThroughHttp() throws Exception {
        postJson("/governance/tokenRatio/update", "{\"height\":101,\"timeNanos\":" + TIME
                + ",\"sender\":\"admin\",\"tokenGroupId\":\"" + VALIDATOR_1 + "\",\"ratio\":1}")
                .andExpect(jsonPath("$.code").value(200));

        postJson("/lock/lockTokens", "{\"height\":102,\"timeNanos\":" + TIME + ",\"sender\":\"" + USER
                + "\",\"funds\":{\"denom\":\"" + VALIDATOR_1_DENOM + "\",\"amount\":1000},\"lockDuration\":"
                + 3 * ROUND_LENGTH + "}")
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.lockId").value(0))
                .andExpect(jsonPath("$.data.funds.amount").value(1000));

        postJson("/governance/proposal/create", "{\"height\":103,\"timeNanos\":" + TIME
                + ",\"sender\":\"admin\",\"trancheId\":1,\"title\":\"p0\",\"description\":\"d\","
                + "\"deploymentDuration\":1}")
                .andExpect(jsonPath("$.data.proposalId").value(0));

        postJson("/vote/vote", "{\"height\":104,\"timeNanos\":" + TIME + ",\"sender\":\"" + USER
                + "\",\"trancheId\":1,\"proposals\":[{\"proposalId\":0,\"lockIds\":[0]}]}")
                .andExpect(jsonPath("$.data.votedLockIds[0]").value(0));

        mockMvc.perform(get("/governance/proposal")
                        .param("roundId", "0").param("trancheId", "1").param("proposalId", "0")
                        .param("height", "104").param("timeNanos", String.valueOf(TIME)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.power").value(1500));

        mockMvc.perform(get("/slash/slashable")
                        .param("roundId", "0").param("trancheId", "1").param("proposalId", "0")
                        .param("height", "104").param("timeNanos", String.valueOf(TIME)))
                .andExpect(jsonPath("$.data").value(1000));
    }

    @Test
    void ledgerErrorsAreWrappedInResult() throws Exception {
        postJson("/slash/proposalVoters", "{\"height\":101,\"timeNanos\":" + TIME + ",\"sender\":\"" + USER
                + "\",\"roundId\":0,\"trancheId\":1,\"proposalId\":0,\"slashPercent\":0.5,\"startFrom\":0,"
                + "\"limit\":10}")
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value(510));

        mockMvc.perform(get("/lock/detail")
                        .param("lockId", "42").param("height", "101").param("timeNanos", String.valueOf(TIME)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value(500))
                .andExpect(jsonPath("$.message").value(containsString("Lock with id 42 not found")));
    }

    private ResultActions postJson(String path, String body) throws Exception {
        log.info("POST {} {}", path, body);
        return mockMvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk());
    }
}
