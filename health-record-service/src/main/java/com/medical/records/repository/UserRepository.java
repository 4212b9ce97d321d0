package com.medical.records.repository;

import com.medical.records.model.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {
    Optional<User> findByUserId(String userId);

    List<User> findByUserIdIn(Collection<String> userIds);

    @Query("SELECT u FROM User u WHERE u.userId IN :userIds AND "
            + "(LOWER(u.name) LIKE LOWER(CONCAT('%', :search, '%')) "
            + "OR LOWER(u.email) LIKE LOWER(CONCAT('%', :search, '%')))")
    List<User> searchByUserIdIn(@Param("userIds") Collection<String> userIds, @Param("search") String search);
}
