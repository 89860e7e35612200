package com.cos.race_prevention.blogview.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

/**
 * 블로그 게시글 - 조회수(views) 동시성 예제용 엔티티
 *
 * views는 setter도 increment()도 없음.
 * 값 변경은 오직 PostRepository.incrementViews()의 단일 UPDATE 문으로만 일어남
 * UPDATE posts SET views = views + 1 WHERE id = ?
 */
@Entity
@Table(name = "posts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Post implements Persistable<Long> {

    @Id
    private Long id;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false, length = 4096)
    private String content;

    @Column(nullable = false)
    private Long views = 0L;

    /**
     * id를 직접 지정하므로 save() 시 merge가 아닌 persist(INSERT)가 되도록 함.
     * 이미 존재하는 행이면 INSERT가 PK 제약에 걸려 실패하고, 기존 값은 덮어쓰지 않음
     */
    @Transient
    @Getter(AccessLevel.NONE)
    private boolean newEntity = true;

    public Post(Long id, String title, String content) {
        this.id = id;
        this.title = title;
        this.content = content;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }
}
