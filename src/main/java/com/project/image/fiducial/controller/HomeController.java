package com.project.image.fiducial.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Начална страница: кратко описание на измерването и връзка към формата.
 */
@Controller
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    // Мерна единица на реалната ширина, показва се в описанието
    @Value("${app.measurement.unit:microns}")
    private String unit;

    @GetMapping("/")
    public String index(Model model) {
        log.debug("Serving home page");
        model.addAttribute("unit", unit);
        return "index"; // templates/index.html
    }
}
