package com.agentbench.dispatch.api;

import com.agentbench.core.model.Tier;
import com.agentbench.core.model.UserAccount;
import com.agentbench.core.service.UserService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @PutMapping("/{userId}")
    public UserAccount register(@PathVariable String userId,
                                @RequestParam(defaultValue = "freemium") String tier) {
        return userService.registerUser(userId, Tier.fromValue(tier));
    }

    @GetMapping("/{userId}")
    public UserAccount get(@PathVariable String userId) {
        return userService.getUser(userId);
    }

    @PostMapping("/{userId}/usage")
    public Map<String, Object> incrementUsage(@PathVariable String userId) {
        return Map.of("user_id", userId, "tests_this_month", userService.incrementUsage(userId));
    }

    /**
     * POST /api/v1/users/reset-usage: Resets the monthly counter of all freemium users.
     */
    @PostMapping("/reset-usage")
    public Map<String, Object> resetUsage() {
        return Map.of("reset", userService.resetMonthlyUsage());
    }
}
