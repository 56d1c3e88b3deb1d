package com.streamfirst.tokenindex.boot.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.streamfirst.tokenindex.application.BatchLookupResult;
import com.streamfirst.tokenindex.application.TokenLookupService;
import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.CidCacheEntry;
import com.streamfirst.tokenindex.domain.RequestValidationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Read-only lookup API over the CID cache. */
@Slf4j
@RestController
@ConditionalOnWebApplication
@RequiredArgsConstructor
public class LookupController {

    private static final Resource API_DOCS = new ClassPathResource("static/api-docs.html");

    private final TokenLookupService lookup;

    @GetMapping(value = "/token/{cid}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> getToken(@PathVariable("cid") String cid) {
        log.debug("Lookup {}", cid);
        Cid parsed;
        try {
            parsed = Cid.of(cid);
        } catch (IllegalArgumentException e) {
            return notFound(cid);
        }
        return lookup.getOne(parsed)
                .map(entry -> ResponseEntity.ok(toJson(entry)))
                .orElseGet(() -> notFound(cid));
    }

    @PostMapping(value = "/tokens/batch", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> getTokens(@RequestBody JsonNode body) {
        if (body == null || !body.isObject() || !body.has("cids")) {
            throw new RequestValidationException("Missing 'cids' field in request body");
        }
        JsonNode cids = body.get("cids");
        if (!cids.isArray()) {
            throw new RequestValidationException("'cids' must be an array");
        }
        List<String> requested = new ArrayList<>(cids.size());
        for (JsonNode cid : cids) {
            requested.add(cid.isTextual() ? cid.asText() : null);
        }
        BatchLookupResult result = lookup.getBatch(requested);

        Map<String, Object> results = new LinkedHashMap<>();
        for (CidCacheEntry entry : result.results()) {
            results.put(entry.cid().value(), toJson(entry));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("results", results);
        response.put("not_found", result.notFound());
        response.put("total_requested", result.totalRequested());
        response.put("total_found", result.totalFound());
        response.put("total_not_found", result.totalNotFound());
        return response;
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> health() {
        return lookup.health();
    }

    @GetMapping(value = "/api-docs", produces = MediaType.TEXT_HTML_VALUE)
    public Resource apiDocs() {
        return API_DOCS;
    }

    static Map<String, Object> toJson(CidCacheEntry entry) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("cid", entry.cid().value());
        json.put("content", entry.content());
        json.put("token_level", entry.level());
        json.put("token_number", entry.number());
        return json;
    }

    private static ResponseEntity<Map<String, Object>> notFound(String cid) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "not_found");
        body.put("cid", cid);
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }
}
