package com.dinnerplans.restaurants.application.service;

import com.dinnerplans.restaurants.application.port.in.ManageAttendanceUseCase;
import com.dinnerplans.restaurants.application.port.out.AttendeeRepository;
import com.dinnerplans.restaurants.application.port.out.DinnerGroupRepository;
import com.dinnerplans.restaurants.application.port.out.VenueCatalogRepository;
import com.dinnerplans.restaurants.domain.exception.AttendanceConflictException;
import com.dinnerplans.restaurants.domain.exception.VenueNotFoundException;
import com.dinnerplans.restaurants.domain.model.AttendanceAction;
import com.dinnerplans.restaurants.domain.model.Attendee;
import com.dinnerplans.restaurants.domain.model.DinnerGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Application service for dinner group membership.
 *
 * A user is either attending no restaurant or exactly one. Joining another restaurant
 * replaces the membership (delete, find-or-create group, insert) in a single transaction.
 *
 * Concurrency:
 * - calls for the same user are serialized in-process through a striped lock
 * - the unique constraints on attendee.user_id and dinner_group.restaurant_id guard
 *   against other instances; a violation rolls the whole transaction back and it is
 *   retried once before surfacing as {@link AttendanceConflictException}
 */
@Service
public class AttendanceService implements ManageAttendanceUseCase {

    private static final Logger logger = LoggerFactory.getLogger(AttendanceService.class);

    private static final int LOCK_STRIPES = 64;

    private final AttendeeRepository attendeeRepository;
    private final DinnerGroupRepository dinnerGroupRepository;
    private final VenueCatalogRepository venueCatalogRepository;
    private final TransactionOperations transactionOperations;
    private final Lock[] userLocks;

    @Autowired
    public AttendanceService(
            AttendeeRepository attendeeRepository,
            DinnerGroupRepository dinnerGroupRepository,
            VenueCatalogRepository venueCatalogRepository,
            TransactionOperations transactionOperations) {
        this(attendeeRepository, dinnerGroupRepository, venueCatalogRepository, transactionOperations, LOCK_STRIPES);
    }

    AttendanceService(
            AttendeeRepository attendeeRepository,
            DinnerGroupRepository dinnerGroupRepository,
            VenueCatalogRepository venueCatalogRepository,
            TransactionOperations transactionOperations,
            int lockStripes) {
        this.attendeeRepository = attendeeRepository;
        this.dinnerGroupRepository = dinnerGroupRepository;
        this.venueCatalogRepository = venueCatalogRepository;
        this.transactionOperations = transactionOperations;
        this.userLocks = new Lock[lockStripes];
        for (int i = 0; i < lockStripes; i++) {
            userLocks[i] = new ReentrantLock();
        }
    }

    @Override
    public void apply(String userId, AttendanceAction action) {
        if (action instanceof AttendanceAction.Join join) {
            join(userId, join.restaurantId());
        } else if (action instanceof AttendanceAction.Leave) {
            leave(userId);
        } else {
            throw new IllegalArgumentException("Unsupported attendance action: " + action);
        }
    }

    @Override
    public Optional<String> currentRestaurant(String userId) {
        return attendeeRepository.findRestaurantIdByUserId(userId);
    }

    /**
     * Join the dinner group of a restaurant, leaving any other group first.
     * No-op if the user already attends that restaurant.
     *
     * @param userId User joining
     * @param restaurantId Restaurant whose group to join
     */
    public void join(String userId, String restaurantId) {
        requireUser(userId);
        Lock lock = lockFor(userId);
        lock.lock();
        try {
            Boolean changed = withConflictRetry("join", userId, () -> transactionOperations.execute(status -> {
                Optional<String> current = attendeeRepository.findRestaurantIdByUserId(userId);
                if (current.filter(restaurantId::equals).isPresent()) {
                    return false;
                }
                if (!venueCatalogRepository.existsById(restaurantId)) {
                    throw new VenueNotFoundException(restaurantId);
                }

                attendeeRepository.deleteByUserId(userId);
                DinnerGroup group = dinnerGroupRepository.findByRestaurantId(restaurantId)
                        .orElseGet(() -> createGroup(restaurantId));
                attendeeRepository.saveAndFlush(new Attendee(userId, group));
                current.ifPresent(previous ->
                        logger.info("User {} switched dinner group from {} to {}", userId, previous, restaurantId));
                return true;
            }));

            if (Boolean.TRUE.equals(changed)) {
                logger.info("User {} joined dinner group for restaurant {}", userId, restaurantId);
            } else {
                logger.debug("User {} already attends restaurant {}, nothing to do", userId, restaurantId);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Leave the user's dinner group. No-op if the user attends none.
     *
     * @param userId User leaving
     */
    public void leave(String userId) {
        requireUser(userId);
        Lock lock = lockFor(userId);
        lock.lock();
        try {
            Integer removed = withConflictRetry("leave", userId,
                    () -> transactionOperations.execute(status -> attendeeRepository.deleteByUserId(userId)));
            if (removed != null && removed > 0) {
                logger.info("User {} left their dinner group", userId);
            } else {
                logger.debug("User {} attends no dinner group, nothing to leave", userId);
            }
        } finally {
            lock.unlock();
        }
    }

    private DinnerGroup createGroup(String restaurantId) {
        logger.debug("Creating dinner group for restaurant {}", restaurantId);
        return dinnerGroupRepository.saveAndFlush(new DinnerGroup(restaurantId));
    }

    /**
     * Run one transactional attempt, retrying it once if it lost a race on a unique
     * constraint or a row lock.
     */
    private <T> T withConflictRetry(String operation, String userId, Supplier<T> attempt) {
        try {
            return attempt.get();
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            logger.warn("Conflict during {} for user {}, retrying once: {}", operation, userId, e.getMessage());
        }
        try {
            return attempt.get();
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            logger.error("Conflict during {} for user {} persisted after retry", operation, userId, e);
            throw new AttendanceConflictException(
                    "Dinner group membership changed concurrently, please try again", e);
        }
    }

    private Lock lockFor(String userId) {
        return userLocks[Math.floorMod(userId.hashCode(), userLocks.length)];
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
    }
}
