package com.costtracker.costs.user;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface UserRepository extends JpaRepository<UserEntity, Long> {
    Optional<UserEntity> findByUserId(long userId);

    boolean existsByUserId(long userId);

    List<UserEntity> findAllByOrderByUserIdAsc();
}
