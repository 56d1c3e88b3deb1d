package com.streamfirst.tokenindex.adapters;

import com.streamfirst.tokenindex.domain.AddException;
import com.streamfirst.tokenindex.domain.Cid;
import com.streamfirst.tokenindex.domain.FetchException;
import com.streamfirst.tokenindex.domain.PinException;
import com.streamfirst.tokenindex.ports.ContentNetworkPort;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * In-memory implementation of ContentNetworkPort for testing and development.
 *
 * <p>CIDs are deterministic: the CIDv0 wrapping the SHA-256 of the content bytes. They differ from
 * the CIDs a real node computes for the same content but keep the property that equal content
 * gives equal CIDs.
 */
@Slf4j
public class InMemoryContentNetworkAdapter implements ContentNetworkPort {

    private final String name;

    private final Map<Cid, String> blocks = new ConcurrentHashMap<>();
    private final Set<Cid> pins = ConcurrentHashMap.newKeySet();
    private final AtomicLong addCalls = new AtomicLong();

    private volatile Predicate<String> addFailure = content -> false;
    private volatile Predicate<Cid> fetchFailure = cid -> false;
    private volatile Predicate<Cid> pinFailure = cid -> false;

    public InMemoryContentNetworkAdapter() {
        this("memory");
    }

    public InMemoryContentNetworkAdapter(String name) {
        this.name = name;
    }

    /** The CID this adapter assigns to {@code content}. */
    public static Cid cidOf(String content) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(content.getBytes(StandardCharsets.UTF_8));
            return Cid.v0FromSha256(HexFormat.of().formatHex(digest));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String fetch(Cid cid) {
        if (fetchFailure.test(cid)) {
            throw new FetchException("Injected fetch failure for " + cid);
        }
        String content = blocks.get(cid);
        if (content == null) {
            throw new FetchException("Content not found on " + name + ": " + cid);
        }
        log.debug("Fetched {} from {}", cid, name);
        return content;
    }

    @Override
    public Cid add(String content, boolean onlyHash) {
        addCalls.incrementAndGet();
        if (addFailure.test(content)) {
            throw new AddException("Injected add failure");
        }
        Cid cid = cidOf(content);
        if (!onlyHash) {
            blocks.put(cid, content);
            pins.add(cid);
        }
        return cid;
    }

    @Override
    public void pin(Cid cid) {
        if (pinFailure.test(cid)) {
            throw new PinException("Injected pin failure for " + cid);
        }
        if (!blocks.containsKey(cid)) {
            throw new PinException("Cannot pin unknown content " + cid + " on " + name);
        }
        pins.add(cid);
        log.debug("Pinned {} on {}", cid, name);
    }

    @Override
    public boolean isPinned(Cid cid) {
        return pins.contains(cid);
    }

    @Override
    public String endpoint() {
        return "memory://" + name;
    }

    /**
     * Stores content under its own CID without pinning it, as a node publishing a token would.
     */
    public Cid publish(String content) {
        Cid cid = cidOf(content);
        blocks.put(cid, content);
        return cid;
    }

    /**
     * Stores content under an arbitrary CID, simulating a node whose CID does not address the text.
     */
    public void publishAs(Cid cid, String content) {
        blocks.put(Objects.requireNonNull(cid), Objects.requireNonNull(content));
    }

    public void failAddsWhere(Predicate<String> matcher) {
        this.addFailure = Objects.requireNonNull(matcher);
    }

    public void failFetchesWhere(Predicate<Cid> matcher) {
        this.fetchFailure = Objects.requireNonNull(matcher);
    }

    public void failPinsWhere(Predicate<Cid> matcher) {
        this.pinFailure = Objects.requireNonNull(matcher);
    }

    public long getAddCalls() {
        return addCalls.get();
    }

    public Set<Cid> getPins() {
        return Set.copyOf(pins);
    }
}
