package com.voucherpay.api.api;

import com.voucherpay.security.AuthenticatedUser;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Placeholder domain endpoints. Each requires an access token; the bodies are fixed.
 */
@RestController
@RequestMapping("/api/v1")
public class DomainController {

    @GetMapping("/users")
    public Map<String, Object> users(AuthenticatedUser user) {
        return overview("Users endpoint - Implementation in progress",
                "profile_management", "accessibility_preferences", "social_connections");
    }

    @GetMapping("/users/profile")
    public Map<String, Object> profile(AuthenticatedUser user) {
        return Map.of(
                "message", "User profile endpoint - Implementation in progress",
                "accessibility_ready", true);
    }

    @GetMapping("/jobs")
    public Map<String, Object> jobs(AuthenticatedUser user) {
        return overview("Jobs endpoint - Inclusive employment marketplace",
                "accessibility_accommodations", "inclusive_hiring", "disability_friendly_employers");
    }

    @GetMapping("/finance")
    public Map<String, Object> finance(AuthenticatedUser user) {
        return overview("Finance endpoint - Business funding and financial empowerment",
                "disability_business_grants", "accessible_banking", "financial_assistance");
    }

    @GetMapping("/energy")
    public Map<String, Object> energy(AuthenticatedUser user) {
        return overview("Energy endpoint - Sustainable energy and accessibility",
                "accessible_energy_programs", "sustainability_tracking", "green_initiatives");
    }

    @GetMapping("/carbon")
    public Map<String, Object> carbon(AuthenticatedUser user) {
        return overview("Carbon endpoint - Environmental impact and accessibility",
                "accessible_carbon_tracking", "inclusive_green_projects", "environmental_justice");
    }

    @GetMapping("/ai")
    public Map<String, Object> ai(AuthenticatedUser user) {
        return overview("AI endpoint - AI-powered accessibility and empowerment assistance",
                "accessibility_ai", "personalized_recommendations", "assistive_intelligence");
    }

    @GetMapping("/policy")
    public Map<String, Object> policy(AuthenticatedUser user) {
        return overview("Policy endpoint - Advocacy, compliance, and non-discrimination",
                "policy_advocacy", "compliance_tracking", "discrimination_reporting");
    }

    @GetMapping("/analytics")
    public Map<String, Object> analytics(AuthenticatedUser user) {
        return overview("Analytics endpoint - Real-time empowerment impact tracking",
                "impact_metrics", "accessibility_analytics", "barrier_reduction_tracking");
    }

    private static Map<String, Object> overview(String message, String... features) {
        return Map.of("message", message, "empowerment_features", List.of(features));
    }
}
