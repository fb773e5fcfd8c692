package com.lunchmate.backend.menuday.repo;

import com.lunchmate.backend.menuday.entity.MenuDayEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface MenuDayRepository extends JpaRepository<MenuDayEntity, Long> {

    Optional<MenuDayEntity> findByCookIdAndLocalDate(String cookId, LocalDate localDate);

    @Query("""
        select m from MenuDayEntity m
         where m.cookId = :cookId
           and m.localDate >= :fromDate
           and m.localDate < :toDateExclusive
         order by m.localDate asc
    """)
    List<MenuDayEntity> findRange(@Param("cookId") String cookId,
                                  @Param("fromDate") LocalDate fromDate,
                                  @Param("toDateExclusive") LocalDate toDateExclusive);

    /**
     * Atomic counter change; never drops below zero. Returns affected rows (0 means the guard refused it).
     */
    @Modifying(flushAutomatically = true)
    @Query("""
        update MenuDayEntity m
           set m.confirmationsCount = m.confirmationsCount + :delta
         where m.id = :id
           and m.confirmationsCount + :delta >= 0
    """)
    int adjustConfirmations(@Param("id") Long id, @Param("delta") int delta);
}
