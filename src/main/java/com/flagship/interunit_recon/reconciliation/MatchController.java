package com.flagship.interunit_recon.reconciliation;

import com.flagship.interunit_recon.reconciliation.dto.MatchedLegResponse;
import com.flagship.interunit_recon.reconciliation.dto.ReviewRequest;
import com.flagship.interunit_recon.reconciliation.dto.ReviewResponse;
import com.flagship.interunit_recon.transaction.MatchStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Lists stored matches and records review decisions on them.
 */
@RestController
@RequestMapping("/api/matches")
@RequiredArgsConstructor
public class MatchController {

    private final MatchReviewService reviewService;

    @GetMapping
    public ResponseEntity<List<MatchedLegResponse>> list(
            @RequestParam(value = "status", defaultValue = "matched") String status) {
        List<MatchedLegResponse> matches = reviewService.listMatches(MatchStatus.fromDbValue(status))
            .stream()
            .map(MatchedLegResponse::from)
            .toList();
        return ResponseEntity.ok(matches);
    }

    @PostMapping("/{uid}/accept")
    public ResponseEntity<ReviewResponse> accept(@PathVariable("uid") String uid,
                                                 @Valid @RequestBody(required = false) ReviewRequest request) {
        return ResponseEntity.ok(ReviewResponse.from(reviewService.accept(uid, reviewer(request))));
    }

    @PostMapping("/{uid}/reject")
    public ResponseEntity<ReviewResponse> reject(@PathVariable("uid") String uid,
                                                 @Valid @RequestBody(required = false) ReviewRequest request) {
        return ResponseEntity.ok(ReviewResponse.from(reviewService.reject(uid, reviewer(request))));
    }

    private static String reviewer(ReviewRequest request) {
        return request != null ? request.getReviewedBy() : null;
    }
}
