package app.scoliofit.core.adherence.controller;

import app.scoliofit.core.adherence.controller.dto.AdherenceSummaryResponse;
import app.scoliofit.core.adherence.controller.dto.RecordExerciseRequest;
import app.scoliofit.core.adherence.controller.dto.ReminderClaimResponse;
import app.scoliofit.core.adherence.controller.dto.UpdateGoalRequest;
import app.scoliofit.core.adherence.controller.dto.UpdateNotificationsRequest;
import app.scoliofit.core.adherence.service.AdherenceService;
import app.scoliofit.core.security.CurrentUserProvider;
import jakarta.validation.Valid;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/adherence")
public class AdherenceController {

    private final CurrentUserProvider currentUserProvider;
    private final AdherenceService adherenceService;

    public AdherenceController(CurrentUserProvider currentUserProvider,
                               AdherenceService adherenceService) {
        this.currentUserProvider = currentUserProvider;
        this.adherenceService = adherenceService;
    }

    // GET /adherence?goalDays=4
    @GetMapping
    public AdherenceSummaryResponse getSummary(@AuthenticationPrincipal Jwt jwt,
                                               @RequestParam(required = false) Integer goalDays) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return adherenceService.getOrInitialize(userId, goalDays);
    }

    @PostMapping("/today/complete")
    public AdherenceSummaryResponse markTodayComplete(@AuthenticationPrincipal Jwt jwt) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return adherenceService.markTodayComplete(userId);
    }

    @DeleteMapping("/today/complete")
    public AdherenceSummaryResponse unmarkTodayComplete(@AuthenticationPrincipal Jwt jwt) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return adherenceService.unmarkTodayComplete(userId);
    }

    @PostMapping("/today/exercises")
    public AdherenceSummaryResponse recordExercise(@AuthenticationPrincipal Jwt jwt,
                                                   @Valid @RequestBody RecordExerciseRequest request) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return adherenceService.recordExercise(userId, request.exerciseId(), request.section());
    }

    // goal outside 1..7 is clamped, not rejected
    @PutMapping("/goal")
    public AdherenceSummaryResponse updateGoal(@AuthenticationPrincipal Jwt jwt,
                                               @Valid @RequestBody UpdateGoalRequest request) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return adherenceService.updateWeeklyGoal(userId, request.goalDays());
    }

    @PatchMapping("/notifications")
    public AdherenceSummaryResponse updateNotifications(@AuthenticationPrincipal Jwt jwt,
                                                        @RequestBody UpdateNotificationsRequest request) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return adherenceService.updateNotificationSettings(userId, request.toPatch());
    }

    @PostMapping("/freeze")
    public AdherenceSummaryResponse useStreakFreeze(@AuthenticationPrincipal Jwt jwt) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return adherenceService.useStreakFreeze(userId);
    }

    @PostMapping("/reminder/claim")
    public ReminderClaimResponse claimReminder(@AuthenticationPrincipal Jwt jwt) {
        UUID userId = currentUserProvider.getUserId(jwt);
        return adherenceService.claimReminder(userId);
    }
}
