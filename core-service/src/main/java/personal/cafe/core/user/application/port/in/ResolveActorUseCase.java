package personal.cafe.core.user.application.port.in;

import personal.cafe.core.user.domain.model.Actor;

/**
 * Resolve Actor UseCase (Input Port)
 * 인증된 사용자 ID를 역할이 포함된 Actor로 변환
 */
public interface ResolveActorUseCase {

    /**
     * @param userId 인증 계층에서 전달된 사용자 ID
     * @return 사용자 ID와 역할
     * @throws personal.cafe.core.user.domain.exception.UserNotFoundException 사용자가 존재하지 않을 때
     */
    Actor resolveActor(Long userId);
}
