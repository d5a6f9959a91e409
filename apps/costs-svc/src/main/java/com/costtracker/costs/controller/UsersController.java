package com.costtracker.costs.controller;

import com.costtracker.costs.controller.dto.AddUserRequestDto;
import com.costtracker.costs.controller.dto.UserDetailsResponseDto;
import com.costtracker.costs.controller.dto.UserResponseDto;
import com.costtracker.costs.exception.InvalidInputException;
import com.costtracker.costs.model.User;
import com.costtracker.costs.user.UserService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
public class UsersController {

    private final UserService userService;

    public UsersController(UserService userService) {
        this.userService = userService;
    }

    @PostMapping
    public ResponseEntity<UserResponseDto> addUser(@RequestBody @Valid AddUserRequestDto request) {
        User saved = userService.addUser(new UserService.NewUser(
                request.id(),
                request.firstName(),
                request.lastName(),
                request.birthday()));
        return ResponseEntity.ok(map(saved));
    }

    @GetMapping
    public ResponseEntity<List<UserResponseDto>> listUsers() {
        return ResponseEntity.ok(userService.listUsers().stream().map(this::map).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<UserDetailsResponseDto> getUser(@PathVariable("id") String id) {
        long userId;
        try {
            userId = Long.parseLong(id.trim());
        } catch (NumberFormatException ex) {
            throw new InvalidInputException(UserService.ERROR_PATH_ID_NOT_NUMBER, "User id in URL must be a Number");
        }
        UserService.UserDetails details = userService.getUser(userId);
        User user = details.user();
        return ResponseEntity.ok(new UserDetailsResponseDto(user.firstName(), user.lastName(), user.id(), details.total()));
    }

    private UserResponseDto map(User user) {
        return new UserResponseDto(user.id(), user.firstName(), user.lastName(), user.birthday());
    }
}
