package com.nevis.reports.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class ApiInfoController {

    static final String MESSAGE = "PDF Reports Management API";

    @GetMapping({"", "/"})
    public ApiInfoResponse info() {
        return new ApiInfoResponse(MESSAGE);
    }
}
