package com.costtracker.costs.user;

import com.costtracker.costs.exception.InvalidInputException;
import com.costtracker.costs.exception.StorageUnavailableException;
import com.costtracker.costs.exception.UserNotFoundException;
import com.costtracker.costs.model.User;
import com.costtracker.costs.repository.CostRecordRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    static final int ERROR_MISSING_FIELDS = 1;
    static final int ERROR_ID_NOT_NUMBER = 2;
    static final int ERROR_NAMES = 3;
    static final int ERROR_BIRTHDAY = 4;
    static final int ERROR_DUPLICATE = 5;
    public static final int ERROR_PATH_ID_NOT_NUMBER = 6;

    private final UserRepository userRepository;
    private final CostRecordRepository costRecordRepository;

    public UserService(UserRepository userRepository, CostRecordRepository costRecordRepository) {
        this.userRepository = userRepository;
        this.costRecordRepository = costRecordRepository;
    }

    public record NewUser(Long id, String firstName, String lastName, String birthday) {}

    public record UserDetails(User user, BigDecimal total) {}

    public User addUser(NewUser request) {
        if (request.id() == null || request.firstName() == null || request.lastName() == null || request.birthday() == null) {
            throw new InvalidInputException(ERROR_MISSING_FIELDS, "Missing required fields: id, first_name, last_name, birthday");
        }
        if (request.id() <= 0) {
            throw new InvalidInputException(ERROR_ID_NOT_NUMBER, "id must be a positive Number");
        }
        if (request.firstName().isBlank() || request.lastName().isBlank()) {
            throw new InvalidInputException(ERROR_NAMES, "first_name and last_name must be Strings");
        }
        LocalDate birthday = parseBirthday(request.birthday());

        if (exists(request.id())) {
            throw new InvalidInputException(ERROR_DUPLICATE, "User with this id already exists");
        }
        try {
            UserEntity saved = userRepository.saveAndFlush(new UserEntity(request.id(), request.firstName(), request.lastName(), birthday));
            log.info("User {} added", saved.getUserId());
            return toModel(saved);
        } catch (DataIntegrityViolationException ex) {
            // lost a race against a concurrent insert of the same id
            throw new InvalidInputException(ERROR_DUPLICATE, "User with this id already exists");
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("User store unavailable", ex);
        }
    }

    public List<User> listUsers() {
        try {
            return userRepository.findAllByOrderByUserIdAsc().stream().map(this::toModel).toList();
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("User store unavailable", ex);
        }
    }

    public UserDetails getUser(long userId) {
        try {
            User user = userRepository.findByUserId(userId)
                    .map(this::toModel)
                    .orElseThrow(() -> new UserNotFoundException(userId));
            return new UserDetails(user, costRecordRepository.sumByUserId(userId));
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("User store unavailable", ex);
        }
    }

    public boolean exists(long userId) {
        try {
            return userRepository.existsByUserId(userId);
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("User store unavailable", ex);
        }
    }

    private LocalDate parseBirthday(String value) {
        String trimmed = value.trim();
        try {
            return trimmed.length() > 10 ? OffsetDateTime.parse(trimmed).toLocalDate() : LocalDate.parse(trimmed);
        } catch (DateTimeParseException ex) {
            throw new InvalidInputException(ERROR_BIRTHDAY, "birthday must be a valid Date");
        }
    }

    private User toModel(UserEntity entity) {
        return new User(entity.getUserId(), entity.getFirstName(), entity.getLastName(), entity.getBirthday());
    }
}
