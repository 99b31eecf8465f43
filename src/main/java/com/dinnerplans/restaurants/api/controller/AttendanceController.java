package com.dinnerplans.restaurants.api.controller;

import com.dinnerplans.restaurants.api.dto.AttendanceRequestDto;
import com.dinnerplans.restaurants.api.dto.AttendanceResponseDto;
import com.dinnerplans.restaurants.application.port.in.ManageAttendanceUseCase;
import com.dinnerplans.restaurants.domain.model.AttendanceAction;
import com.dinnerplans.restaurants.infrastructure.security.UserIdentityFilter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for joining and leaving dinner groups.
 */
@RestController
@RequestMapping("/restaurants/attendance")
public class AttendanceController {

    private static final Logger logger = LoggerFactory.getLogger(AttendanceController.class);

    private final ManageAttendanceUseCase manageAttendanceUseCase;

    public AttendanceController(ManageAttendanceUseCase manageAttendanceUseCase) {
        this.manageAttendanceUseCase = manageAttendanceUseCase;
    }

    /**
     * POST /restaurants/attendance
     *
     * Body {"intent":"join","restaurantId":"..."} or {"intent":"leave"}.
     *
     * @return success flag and the restaurant the user now attends, if any
     */
    @PostMapping
    public ResponseEntity<AttendanceResponseDto> changeAttendance(
            @RequestAttribute(UserIdentityFilter.USER_ID_ATTRIBUTE) String userId,
            @Valid @RequestBody AttendanceRequestDto request) {
        AttendanceAction action = request.toAction();
        logger.info("Attendance change: user={}, action={}", userId, action);

        manageAttendanceUseCase.apply(userId, action);
        String restaurantId = manageAttendanceUseCase.currentRestaurant(userId).orElse(null);
        return ResponseEntity.ok(new AttendanceResponseDto(true, restaurantId));
    }

    /**
     * GET /restaurants/attendance
     *
     * @return the restaurant the user currently attends, if any
     */
    @GetMapping
    public ResponseEntity<AttendanceResponseDto> getAttendance(
            @RequestAttribute(UserIdentityFilter.USER_ID_ATTRIBUTE) String userId) {
        String restaurantId = manageAttendanceUseCase.currentRestaurant(userId).orElse(null);
        return ResponseEntity.ok(new AttendanceResponseDto(true, restaurantId));
    }
}
