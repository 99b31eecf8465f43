package com.dinnerplans.restaurants.api.dto;

import com.dinnerplans.restaurants.domain.model.AttendanceAction;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Join/leave request body, discriminated by {@code intent}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AttendanceRequestDto {

    public static final String INTENT_JOIN = "join";
    public static final String INTENT_LEAVE = "leave";

    @NotBlank(message = "intent is required")
    @JsonProperty("intent")
    private String intent;

    @JsonProperty("restaurantId")
    private String restaurantId;

    /**
     * Convert to the action understood by the attendance service.
     *
     * @throws IllegalArgumentException for an unknown intent or a join without restaurant
     */
    public AttendanceAction toAction() {
        return switch (intent) {
            case INTENT_JOIN -> AttendanceAction.join(restaurantId);
            case INTENT_LEAVE -> AttendanceAction.leave();
            default -> throw new IllegalArgumentException("Invalid intent: " + intent);
        };
    }
}
