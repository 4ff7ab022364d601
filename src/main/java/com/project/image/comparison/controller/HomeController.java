package com.project.image.comparison.controller;

import com.project.image.comparison.DTOs.AlignStrategy;
import com.project.image.comparison.DTOs.ComparisonOptions;
import com.project.image.comparison.config.ComparisonDefaults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

import java.util.Arrays;

/**
 * Landing page with the defaults a comparison runs with.
 */
@Controller
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    private final ComparisonDefaults defaults;

    public HomeController(ComparisonDefaults defaults) {
        this.defaults = defaults;
    }

    @GetMapping("/")
    public String index(Model model) {
        ComparisonOptions options = defaults.options();
        model.addAttribute("defaultThreshold", options.threshold());
        model.addAttribute("defaultAlign", options.align().cliName());
        model.addAttribute("strategies", Arrays.stream(AlignStrategy.values()).map(AlignStrategy::cliName).toList());
        log.debug("Serving home page");
        return "index";
    }
}
