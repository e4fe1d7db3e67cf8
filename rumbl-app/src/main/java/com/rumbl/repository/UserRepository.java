package com.rumbl.repository;

import com.rumbl.model.User;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class UserRepository {

    private static final List<User> USERS = List.of(
        new User("1", "José", "josevalim"),
        new User("2", "Bruce", "redrapids"),
        new User("3", "Chris", "chrismccord")
    );

    public List<User> findAll() {
        return USERS;
    }
}
