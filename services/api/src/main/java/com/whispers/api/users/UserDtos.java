package com.whispers.api.users;

record UserUpdateRequest(String username, String email, String password) {}
