package com.gotable.menu.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * 주문 가능한 메뉴. 가격은 최소 통화 단위(엔)로 저장한다.
 */
@Entity
@Table(name = "menus", indexes = {
        @Index(name = "idx_menu_available", columnList = "available")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Menu {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false)
    private int price;

    @Column(length = 500)
    private String imageUrl;

    private boolean available;

    @CreatedDate
    private LocalDateTime createdAt;

    @Builder
    public Menu(String name, String description, int price, String imageUrl, boolean available) {
        if (price < 0) {
            throw new IllegalArgumentException("price must not be negative: " + price);
        }
        this.name = name;
        this.description = description;
        this.price = price;
        this.imageUrl = imageUrl;
        this.available = available;
    }
}
