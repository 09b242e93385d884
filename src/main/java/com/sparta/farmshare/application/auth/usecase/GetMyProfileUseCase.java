package com.sparta.farmshare.application.auth.usecase;

import com.sparta.farmshare.application.auth.dto.UserResponse;
import com.sparta.farmshare.domain.user.exception.UserNotFoundException;
import com.sparta.farmshare.domain.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class GetMyProfileUseCase {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public UserResponse execute(String userId) {
        return userRepository.findById(userId)
                .map(UserResponse::from)
                .orElseThrow(() -> new UserNotFoundException(userId));
    }
}
