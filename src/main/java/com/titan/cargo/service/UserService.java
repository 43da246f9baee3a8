package com.titan.cargo.service;

import com.titan.cargo.dto.in.LoginRequest;
import com.titan.cargo.dto.in.RegisterRequest;
import com.titan.cargo.dto.in.UpdateProfileRequest;
import com.titan.cargo.dto.out.AuthResponse;
import com.titan.cargo.model.User;

public interface UserService {

    AuthResponse register(RegisterRequest request);
    AuthResponse login(LoginRequest request);
    User getProfile(String userId);
    User updateProfile(String userId, UpdateProfileRequest request);
}
