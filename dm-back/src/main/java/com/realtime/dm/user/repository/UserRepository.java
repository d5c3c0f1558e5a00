package com.realtime.dm.user.repository;

import com.realtime.dm.user.entity.User;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface UserRepository extends JpaRepository<User, UUID> {

    // username은 소문자로 저장하지만 외부에서 채워진 행도 고려해 대소문자 무시
    @Query("select u from User u where lower(u.username) = lower(:username)")
    Optional<User> findByUsernameCi(@Param("username") String username);

    /** username/표시명 부분 일치 검색 (본인 제외). q는 소문자로 정규화된 값 */
    @Query("""
           select u from User u
           where u.id <> :meId
             and (lower(u.username) like concat('%', :q, '%')
                  or lower(u.displayName) like concat('%', :q, '%'))
           order by u.username asc
           """)
    List<User> search(@Param("meId") UUID meId, @Param("q") String q, Pageable pageable);
}
