package com.agentbench.dispatch.api;

import com.agentbench.core.error.JobNotFoundException;
import com.agentbench.core.model.AwsAccountConnection;
import com.agentbench.core.routing.AccountConnectionService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cross-account trust setup. Responses never include credentials; the external id is shown so
 * the user can put it in the role's trust policy.
 */
@RestController
@RequestMapping("/api/v1/aws-account")
public class AwsAccountController {

    private final AccountConnectionService connections;

    public AwsAccountController(AccountConnectionService connections) {
        this.connections = connections;
    }

    @PostMapping("/begin")
    public Map<String, Object> begin(@RequestHeader(TestController.USER_HEADER) String userId) {
        return view(connections.beginConnection(userId));
    }

    @PostMapping("/confirm")
    public Map<String, Object> confirm(@RequestHeader(TestController.USER_HEADER) String userId,
                                       @Valid @RequestBody ConnectAccountRequest request) {
        return view(connections.confirmConnection(userId, request.roleArn(), request.region(), request.externalId()));
    }

    @PostMapping("/disconnect")
    public ResponseEntity<Void> disconnect(@RequestHeader(TestController.USER_HEADER) String userId) {
        connections.disconnect(userId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping
    public Map<String, Object> status(@RequestHeader(TestController.USER_HEADER) String userId) {
        return connections.find(userId)
                .map(AwsAccountController::view)
                .orElseThrow(() -> new JobNotFoundException("AWS account connection", userId));
    }

    private static Map<String, Object> view(AwsAccountConnection connection) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", connection.status().name().toLowerCase());
        body.put("external_id", connection.externalId());
        body.put("aws_account_id", connection.awsAccountId());
        body.put("role_arn", connection.roleArn());
        body.put("region", connection.region());
        body.put("connected_at", connection.connectedAt());
        return body;
    }
}
