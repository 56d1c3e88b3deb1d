package com.streamfirst.tokenindex.boot.web;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.streamfirst.tokenindex.application.BatchLookupResult;
import com.streamfirst.tokenindex.application.TokenLookupService;
import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.CidCacheEntry;
import com.streamfirst.tokenindex.domain.PersistenceException;
import com.streamfirst.tokenindex.domain.RequestValidationException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = LookupController.class)
class LookupControllerTest {

    private static final String CID = "QmVaPTddRyjLjMoZnYufWc5M5CjyGNPmFEpp5HtPKEqZFG";
    private static final String CONTENT =
            "0016b86b273ff34fce19d6b804eff5a3f5747ada4eaa22f1d49c01e52ddb7875b4b";
    private static final CidCacheEntry ENTRY = new CidCacheEntry(Cid.of(CID), CONTENT, 1, 1);

    @Autowired MockMvc mvc;

    @MockBean TokenLookupService lookup;

    @Test
    void returnsSingleToken() throws Exception {
        when(lookup.getOne(Cid.of(CID))).thenReturn(Optional.of(ENTRY));

        mvc.perform(get("/token/{cid}", CID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cid").value(CID))
                .andExpect(jsonPath("$.content").value(CONTENT))
                .andExpect(jsonPath("$.token_level").value(1))
                .andExpect(jsonPath("$.token_number").value(1));
    }

    @Test
    void unknownTokenIs404() throws Exception {
        when(lookup.getOne(any())).thenReturn(Optional.empty());

        mvc.perform(get("/token/{cid}", "QmUnknown"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"))
                .andExpect(jsonPath("$.cid").value("QmUnknown"));
    }

    @Test
    void batchResultsAreKeyedByCid() throws Exception {
        when(lookup.getBatch(List.of(CID, "QmMissing", CID)))
                .thenReturn(new BatchLookupResult(List.of(ENTRY), List.of("QmMissing"), 3, 1, 1));

        mvc.perform(
                        post("/tokens/batch")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"cids\":[\"" + CID + "\",\"QmMissing\",\"" + CID + "\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results." + CID + ".token_number").value(1))
                .andExpect(jsonPath("$.not_found[0]").value("QmMissing"))
                .andExpect(jsonPath("$.total_requested").value(3))
                .andExpect(jsonPath("$.total_found").value(1))
                .andExpect(jsonPath("$.total_not_found").value(1));
    }

    @Test
    void batchWithoutCidsFieldIs400() throws Exception {
        mvc.perform(post("/tokens/batch").contentType(MediaType.APPLICATION_JSON).content("{\"ids\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing 'cids' field in request body"));
        verifyNoInteractions(lookup);
    }

    @Test
    void batchWithNonArrayCidsIs400() throws Exception {
        mvc.perform(post("/tokens/batch").contentType(MediaType.APPLICATION_JSON).content("{\"cids\":\"Qm\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("'cids' must be an array"));
    }

    @Test
    void batchWithWrongContentTypeIs400() throws Exception {
        mvc.perform(post("/tokens/batch").contentType(MediaType.TEXT_PLAIN).content("cids=Qm"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Content-Type must be application/json"));
    }

    @Test
    void oversizedBatchReportsReceivedCount() throws Exception {
        when(lookup.getBatch(anyList()))
                .thenThrow(new RequestValidationException("Batch size exceeds maximum of 2", 3));

        mvc.perform(
                        post("/tokens/batch")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"cids\":[\"a\",\"b\",\"c\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Batch size exceeds maximum of 2"))
                .andExpect(jsonPath("$.received").value(3));
    }

    @Test
    void storeFailureIs500WithReference() throws Exception {
        when(lookup.getOne(any())).thenThrow(new PersistenceException("database is locked"));

        mvc.perform(get("/token/{cid}", CID))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("internal_error"))
                .andExpect(jsonPath("$.reference").isNotEmpty());
    }

    @Test
    void healthIsOk() throws Exception {
        when(lookup.health()).thenReturn(Map.of("status", "ok"));

        mvc.perform(get("/health")).andExpect(status().isOk()).andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void apiDocsAreHtml() throws Exception {
        mvc.perform(get("/api-docs"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML));
    }
}
