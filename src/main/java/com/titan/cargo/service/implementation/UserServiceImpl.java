package com.titan.cargo.service.implementation;

import com.titan.cargo.dto.in.LoginRequest;
import com.titan.cargo.dto.in.RegisterRequest;
import com.titan.cargo.dto.in.UpdateProfileRequest;
import com.titan.cargo.dto.out.AuthResponse;
import com.titan.cargo.exception.DuplicateIdentityException;
import com.titan.cargo.exception.InvalidCredentialsException;
import com.titan.cargo.exception.ResourceNotFoundException;
import com.titan.cargo.model.User;
import com.titan.cargo.model.enums.Role;
import com.titan.cargo.model.mapper.DisplayMapper;
import com.titan.cargo.repository.UserRepository;
import com.titan.cargo.security.JwtUtils;
import com.titan.cargo.service.UserService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Date;

@Service
public class UserServiceImpl implements UserService {

    private static final Logger logger = LoggerFactory.getLogger(UserServiceImpl.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtUtils jwtUtils;

    public UserServiceImpl(UserRepository userRepository,
                           PasswordEncoder passwordEncoder,
                           JwtUtils jwtUtils) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtUtils = jwtUtils;
    }

    @Override
    public AuthResponse register(RegisterRequest req) {
        logger.info("Inscription d'un utilisateur avec email: {}", req.email());
        if (userRepository.existsByEmail(req.email())) {
            logger.warn("Email déjà utilisé: {}", req.email());
            throw new DuplicateIdentityException();
        }

        User user = new User();
        user.setName(req.name());
        user.setEmail(req.email());
        user.setPassword(passwordEncoder.encode(req.password()));
        user.setRole(Role.fromValueOrDefault(req.role()));
        user.setPhone(req.phone());
        user.setAddress(req.address());
        user.setCreatedAt(new Date());

        User saved;
        try {
            saved = userRepository.save(user);
        } catch (DuplicateKeyException e) {
            // lost a race against a concurrent registration of the same email
            logger.warn("Email déjà utilisé (index unique): {}", req.email());
            throw new DuplicateIdentityException();
        }

        String token = jwtUtils.generateToken(saved);
        logger.info("Utilisateur inscrit avec succès, ID: {}, rôle: {}", saved.getId(), saved.getRole().getValue());
        return new AuthResponse("User registered successfully", token, DisplayMapper.toSummary(saved));
    }

    @Override
    public AuthResponse login(LoginRequest req) {
        logger.info("Tentative de connexion pour l'email: {}", req.email());
        User user = userRepository.findByEmail(req.email()).orElse(null);
        if (user == null) {
            logger.warn("Échec de connexion: utilisateur inconnu pour l'email: {}", req.email());
            throw new InvalidCredentialsException();
        }
        if (!passwordEncoder.matches(req.password(), user.getPassword())) {
            logger.warn("Échec de connexion: mot de passe invalide pour l'email: {}", req.email());
            throw new InvalidCredentialsException();
        }

        user.setLastLogin(new Date());
        User saved = userRepository.save(user);

        String token = jwtUtils.generateToken(saved);
        logger.info("Connexion réussie pour l'email: {}", req.email());
        return new AuthResponse("Login successful", token, DisplayMapper.toSummary(saved));
    }

    @Override
    public User getProfile(String userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> {
                    logger.warn("Profil introuvable pour l'ID: {}", userId);
                    return new ResourceNotFoundException("User not found");
                });
    }

    @Override
    public User updateProfile(String userId, UpdateProfileRequest req) {
        User user = getProfile(userId);
        if (req.name() != null) {
            user.setName(req.name());
        }
        if (req.phone() != null) {
            user.setPhone(req.phone());
        }
        if (req.address() != null) {
            user.setAddress(req.address());
        }
        User saved = userRepository.save(user);
        logger.info("Profil mis à jour pour l'ID: {}", userId);
        return saved;
    }
}
