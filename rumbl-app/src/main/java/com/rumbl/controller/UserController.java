package com.rumbl.controller;

import com.rumbl.model.User;
import com.rumbl.service.AccountService;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.List;

@Controller
@RequestMapping("/users")
public class UserController {

    private final AccountService accountService;

    public UserController(AccountService accountService) {
        this.accountService = accountService;
    }

    @GetMapping
    public String index(Model model) {
        List<User> users = accountService.list();
        model.addAttribute("users", users);
        return "users/index";
    }

    @GetMapping("/{id}")
    public String show(@PathVariable String id, Model model) {
        // Unknown ids are rendered as a 404 by NotFoundAdvice
        User user = accountService.getOrThrow(id);
        model.addAttribute("user", user);
        return "users/show";
    }
}
