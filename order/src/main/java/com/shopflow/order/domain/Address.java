package com.shopflow.order.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Postal address value object. Embedded twice in {@link Order} (shipping, billing)
 * with column overrides.
 */
@Embeddable
@Getter
@Builder
@ToString
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class Address {

    @Column(length = 100)
    private String firstName;

    @Column(length = 100)
    private String lastName;

    @Column(length = 200)
    private String emailAddress;

    @Column(length = 300)
    private String addressLine;

    @Column(length = 100)
    private String country;

    @Column(length = 100)
    private String state;

    @Column(length = 20)
    private String zipCode;
}
