package com.voucherpay.api.api;

import com.voucherpay.api.config.AccessibilityProperties;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Public accessibility information. No token required. */
@RestController
@RequestMapping("/api/v1/accessibility")
public class AccessibilityController {

    private final String wcagVersion;

    public AccessibilityController(AccessibilityProperties properties) {
        this.wcagVersion = "2.1 " + properties.wcagLevel();
    }

    @GetMapping
    public Map<String, Object> overview() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("platform_accessibility", Map.of(
                "wcag_compliance", wcagVersion,
                "last_audit_date", "2024-01-15",
                "compliance_score", 95.7,
                "certification", "WCAG " + wcagVersion + " Certified"));
        body.put("supported_features", Map.of(
                "screen_readers", Map.of(
                        "supported", true,
                        "tested_with", List.of("NVDA", "JAWS", "VoiceOver", "TalkBack"),
                        "aria_compliance", true,
                        "semantic_markup", true),
                "keyboard_navigation", Map.of(
                        "supported", true,
                        "skip_links", true,
                        "focus_indicators", true,
                        "tab_order_logical", true),
                "visual_accessibility", Map.of(
                        "high_contrast", true,
                        "color_contrast_ratio", "4.5:1 minimum",
                        "text_scaling", "up to 200%",
                        "custom_colors", true),
                "motor_accessibility", Map.of(
                        "large_click_targets", true,
                        "drag_and_drop_alternatives", true,
                        "timeout_extensions", true,
                        "voice_control_support", true),
                "cognitive_accessibility", Map.of(
                        "clear_navigation", true,
                        "consistent_layout", true,
                        "error_prevention", true,
                        "help_available", true)));
        body.put("assistive_technology_support", Map.of(
                "screen_readers", List.of("NVDA", "JAWS", "VoiceOver", "TalkBack", "Orca"),
                "voice_control", List.of("Dragon NaturallySpeaking", "Voice Control", "Voice Access"),
                "switch_navigation", List.of("Switch Control", "Camera Mouse", "Head Mouse"),
                "eye_tracking", List.of("Tobii Dynavox", "EyeGaze Edge")));
        body.put("customization_options", Map.of(
                "theme_options", List.of("Default", "High Contrast", "Dark Mode", "Custom"),
                "font_sizes", List.of("Small (14px)", "Medium (16px)", "Large (18px)", "Extra Large (24px)"),
                "motion_settings", List.of("Standard", "Reduced Motion", "No Animation"),
                "audio_settings", List.of("Standard", "Enhanced", "Captions Only")));
        return body;
    }

    @GetMapping("/audit")
    public Map<String, Object> audit() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("wcag_score", 95.7);
        body.put("compliance_level", "AA");
        body.put("issues_found", List.of(Map.of(
                "severity", "minor",
                "type", "color_contrast",
                "description", "Some secondary text has contrast ratio of 4.4:1 (minimum 4.5:1)",
                "location", "footer links",
                "impact", "low")));
        body.put("recommendations", List.of(
                Map.of(
                        "priority", "high",
                        "category", "navigation",
                        "title", "Add skip navigation links",
                        "description", "Implement skip links for main content, navigation, and search",
                        "benefit", "Improves keyboard navigation efficiency"),
                Map.of(
                        "priority", "medium",
                        "category", "forms",
                        "title", "Enhanced error messaging",
                        "description", "Provide more descriptive error messages with suggestions",
                        "benefit", "Better user experience for screen reader users")));
        return body;
    }

    @GetMapping("/guidelines")
    public Map<String, Object> guidelines() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("wcag_guidelines", Map.of(
                "version", wcagVersion,
                "principles", List.of(
                        principle("Perceivable", "Information must be presentable in ways users can perceive",
                                "Provide text alternatives for images",
                                "Provide captions for videos",
                                "Ensure sufficient color contrast",
                                "Make content adaptable to different presentations"),
                        principle("Operable", "Interface components must be operable",
                                "Make all functionality keyboard accessible",
                                "Give users enough time to read content",
                                "Don't use content that causes seizures",
                                "Help users navigate and find content"),
                        principle("Understandable", "Information and UI operation must be understandable",
                                "Make text readable and understandable",
                                "Make content appear and operate predictably",
                                "Help users avoid and correct mistakes"),
                        principle("Robust", "Content must be robust enough for various assistive technologies",
                                "Maximize compatibility with assistive technologies",
                                "Use valid, semantic HTML",
                                "Ensure content works across different browsers and devices"))));
        body.put("platform_features", Map.of(
                "keyboard_shortcuts", List.of(
                        shortcut("Alt + 1", "Skip to main content"),
                        shortcut("Alt + 2", "Skip to navigation"),
                        shortcut("Alt + 3", "Skip to search"),
                        shortcut("Ctrl + /", "Show all keyboard shortcuts"),
                        shortcut("Escape", "Close modal or dropdown")),
                "screen_reader_features", List.of(
                        "Semantic HTML structure with proper headings",
                        "ARIA landmarks and labels",
                        "Live regions for dynamic content updates",
                        "Descriptive link text and button labels",
                        "Form labels and error associations"),
                "customization_options", List.of(
                        "High contrast themes",
                        "Font size adjustment (14px to 24px)",
                        "Reduced motion settings",
                        "Color customization",
                        "Layout simplification")));
        body.put("support_resources", Map.of(
                "documentation", "/docs/accessibility",
                "video_tutorials", "/help/accessibility-videos",
                "keyboard_guide", "/help/keyboard-navigation",
                "screen_reader_guide", "/help/screen-reader-guide",
                "contact_support", "accessibility@voucherpay.com"));
        return body;
    }

    private static Map<String, Object> principle(String name, String description, String... guidelines) {
        return Map.of("name", name, "description", description, "guidelines", List.of(guidelines));
    }

    private static Map<String, Object> shortcut(String key, String action) {
        return Map.of("key", key, "action", action);
    }
}
