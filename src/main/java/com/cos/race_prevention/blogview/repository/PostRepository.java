package com.cos.race_prevention.blogview.repository;

import com.cos.race_prevention.blogview.entity.Post;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Post 레포지토리
 *
 * 조회수 증가는 엔티티를 읽어서 +1 하지 않고 DB가 직접 계산하도록 함
 */
public interface PostRepository extends JpaRepository<Post, Long> {

    /**
     * 조회수 원자적 증가
     *
     * 실행되는 SQL:
     * UPDATE posts SET views = views + 1 WHERE id = ?
     *
     * views + 1은 애플리케이션이 이전에 읽은 값이 아니라
     * 문장 실행 시점에 DB에 저장된 현재 값으로 계산됨.
     * 같은 행에 대한 UPDATE는 DB가 행 락으로 직렬화하므로 Lost Update 없음
     *
     * @return 변경된 행 수 (0이면 해당 id 없음)
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Post p SET p.views = p.views + 1 WHERE p.id = :id")
    int incrementViews(@Param("id") Long id);
}
