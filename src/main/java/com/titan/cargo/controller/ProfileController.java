package com.titan.cargo.controller;

import com.titan.cargo.dto.in.UpdateProfileRequest;
import com.titan.cargo.dto.out.ProfileResponse;
import com.titan.cargo.model.User;
import com.titan.cargo.security.AuthenticatedUser;
import com.titan.cargo.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth/profile")
@Tag(name = "Gestion du profil", description = "Lecture et mise à jour du profil de l'utilisateur connecté.")
public class ProfileController {

    private final UserService userService;

    public ProfileController(UserService userService) {
        this.userService = userService;
    }

    @Operation(summary = "Profil courant", description = "Renvoie l'utilisateur du jeton, sans mot de passe.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Profil trouvé"),
            @ApiResponse(responseCode = "404", description = "Utilisateur non trouvé")
    })
    @GetMapping
    public ResponseEntity<User> getProfile(@AuthenticationPrincipal AuthenticatedUser caller) {
        return ResponseEntity.ok(userService.getProfile(caller.userId()));
    }

    @Operation(summary = "Mettre à jour le profil", description = "Met à jour le nom, le téléphone et l'adresse fournis.")
    @PutMapping
    public ResponseEntity<ProfileResponse> updateProfile(@AuthenticationPrincipal AuthenticatedUser caller,
                                                         @RequestBody UpdateProfileRequest request) {
        User user = userService.updateProfile(caller.userId(), request);
        return ResponseEntity.ok(new ProfileResponse("Profile updated successfully", user));
    }
}
