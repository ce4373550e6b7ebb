package com.tony.cardLeague.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Entity
@Getter @Setter @NoArgsConstructor
public class Lobby {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LobbyStatus status = LobbyStatus.WAITING;

    // 0 tant que la ligue n'est pas créée, puis 1..3
    @Column(nullable = false)
    private Integer currentMatchDay = 0;

    @OneToMany(mappedBy = "lobby", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("joinedAt ASC")
    private List<LobbyMember> members = new ArrayList<>();

    public Lobby(String name) {
        this.name = name;
    }

    public void addMember(Long userId) {
        members.add(new LobbyMember(this, userId));
    }

    public List<Long> getMemberIds() {
        return members.stream().map(LobbyMember::getUserId).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Lobby)) return false;
        return id != null && id.equals(((Lobby) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
