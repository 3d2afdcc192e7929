package cn.bitsleep.sysdocs.repo;

import cn.bitsleep.sysdocs.domain.User;
import cn.bitsleep.sysdocs.domain.UserSummary;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {
    Optional<User> findByEmail(String email);
    boolean existsByEmail(String email);
    Optional<UserSummary> findSummaryById(Long id);
    List<User> findAllByOrderByIdAsc();
}
