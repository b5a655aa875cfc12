package com.github.salilvnair.orderbot.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "ob_menu_item")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObMenuItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "item_id")
    private Long itemId;

    @Column(name = "name", nullable = false, unique = true)
    private String name;

    @Column(name = "category", nullable = false)
    private String category;

    @Column(name = "description")
    private String description;

    @Builder.Default
    @Column(name = "available", nullable = false)
    private boolean available = true;
}
