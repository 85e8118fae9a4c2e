package com.infomedia.abacox.callbilling.controller;

import com.infomedia.abacox.callbilling.component.calltracking.CallLifecycleTracker;
import com.infomedia.abacox.callbilling.dto.activecall.ActiveCallSnapshot;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RequiredArgsConstructor
@RestController
@Tag(name = "ActiveCall", description = "Calls in progress")
@RequestMapping("/api/active-call")
public class ActiveCallController {

    private final CallLifecycleTracker tracker;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ActiveCallSnapshot> list() {
        return tracker.activeCalls().stream().map(CallLifecycleTracker::toSnapshot).toList();
    }

    @GetMapping(value = "/{callId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ActiveCallSnapshot get(@PathVariable("callId") String callId) {
        return tracker.find(callId)
                .map(CallLifecycleTracker::toSnapshot)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No active call " + callId));
    }
}
