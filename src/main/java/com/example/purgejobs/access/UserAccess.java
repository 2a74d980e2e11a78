package com.example.purgejobs.access;

import com.example.purgejobs.models.User;
import java.util.Optional;

public interface UserAccess {
    Optional<User> findById(long id);

    Optional<User> findByUsername(String username);
}
