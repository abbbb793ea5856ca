package com.microservices.learningservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "user_profiles")
@Getter
@Setter
@NoArgsConstructor
public class UserProfile {

    @Id
    private Long id;

    @MapsId
    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id")
    private User user;

    @Column(length = 50)
    private String firstName = "";

    @Column(length = 50)
    private String lastName = "";

    @Column
    private String avatar = "";

    @Column(length = 20)
    private String phoneNumber = "";

    @Column(length = 100)
    private String country = "";

    @Column(nullable = false, length = 10)
    private String languagePreference = "en";

    @Column(nullable = false, length = 50)
    private String timezone = "UTC";

    // null while no role has been assigned
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "role_id")
    private Role role;

    public UserProfile(User user) {
        this.user = user;
    }

    public String getDisplayName() {
        String name = ((firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName)).trim();
        return name.isEmpty() ? user.getEmail() : name;
    }
}
