package personal.cafe.core.user.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.cafe.core.user.application.port.in.ResolveActorUseCase;
import personal.cafe.core.user.application.port.out.UserRepository;
import personal.cafe.core.user.domain.exception.UserNotFoundException;
import personal.cafe.core.user.domain.model.Actor;

/**
 * User Application Service
 * 요청 사용자의 역할 판별
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserService implements ResolveActorUseCase {

    private final UserRepository userRepository;

    @Override
    public Actor resolveActor(Long userId) {
        Actor actor = userRepository.findById(userId)
                .orElseThrow(() -> {
                    log.warn("User not found: userId={}", userId);
                    return new UserNotFoundException(userId);
                })
                .toActor();
        log.debug("Actor resolved: userId={}, role={}", userId, actor.role());
        return actor;
    }
}
