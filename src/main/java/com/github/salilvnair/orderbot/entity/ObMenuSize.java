package com.github.salilvnair.orderbot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(
        name = "ob_menu_size",
        uniqueConstraints = {
                @UniqueConstraint(columnNames = {"item_id", "size_code"})
        }
)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObMenuSize {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "size_id")
    private Long sizeId;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @Column(name = "size_code", nullable = false, length = 8)
    private String sizeCode;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Builder.Default
    @Column(name = "available", nullable = false)
    private boolean available = true;
}
