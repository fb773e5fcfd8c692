package com.lunchmate.backend.order.repo;

import com.lunchmate.backend.order.entity.OrderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface OrderRepository extends JpaRepository<OrderEntity, String> {

    Optional<OrderEntity> findByCustomerIdAndCookIdAndDeliveryDateUtc(String customerId, String cookId, Instant deliveryDateUtc);

    @Query("""
        select o from OrderEntity o
         where o.customerId = :customerId
           and o.deliveryDateUtc >= :fromUtc
           and o.deliveryDateUtc < :toUtc
           and (:cookId is null or o.cookId = :cookId)
         order by o.deliveryDateUtc asc, o.cookId asc
    """)
    List<OrderEntity> findCustomerRange(@Param("customerId") String customerId,
                                        @Param("fromUtc") Instant fromUtc,
                                        @Param("toUtc") Instant toUtc,
                                        @Param("cookId") String cookId);

    @Query("""
        select o from OrderEntity o
         where o.cookId = :cookId
           and o.deliveryDateUtc >= :fromUtc
           and o.deliveryDateUtc < :toUtc
           and (:mealId is null or o.mealId = :mealId)
         order by o.deliveryDateUtc asc, o.createdAt asc
    """)
    List<OrderEntity> findCookRange(@Param("cookId") String cookId,
                                    @Param("fromUtc") Instant fromUtc,
                                    @Param("toUtc") Instant toUtc,
                                    @Param("mealId") String mealId);
}
