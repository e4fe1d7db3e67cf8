package com.rumbl.controller;

import com.rumbl.config.RumblConfig;
import com.rumbl.service.UserNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.ModelAndView;

@ControllerAdvice
public class NotFoundAdvice {

    private static final Logger log = LoggerFactory.getLogger(NotFoundAdvice.class);

    private final RumblConfig rumblConfig;

    public NotFoundAdvice(RumblConfig rumblConfig) {
        this.rumblConfig = rumblConfig;
    }

    @ExceptionHandler(UserNotFoundException.class)
    public ModelAndView handleUserNotFound(UserNotFoundException e) {
        log.warn("User not found: {}", e.getUserId());

        // @ModelAttribute methods don't run for exception handlers, so the layout's site name is added here
        ModelAndView mav = new ModelAndView("error/not-found", HttpStatus.NOT_FOUND);
        mav.addObject("siteName", rumblConfig.getSiteName());
        mav.addObject("message", e.getMessage());
        return mav;
    }
}
