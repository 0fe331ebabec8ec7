package com.gotable.menu.repository;

import com.gotable.common.config.JpaConfig;
import com.gotable.menu.entity.Menu;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaConfig.class)
class MenuRepositoryTest {

    @Autowired
    private MenuRepository menuRepository;
    @Autowired
    private TestEntityManager em;

    @Test
    @DisplayName("판매 중 메뉴만 ID 오름차순으로 조회")
    void findByAvailableTrueOrderByIdAsc() {
        Menu ramen = em.persist(Menu.builder().name("Signature Ramen").price(850).available(true).build());
        em.persist(Menu.builder().name("Seasonal Special").price(1200).available(false).build());
        Menu drink = em.persist(Menu.builder().name("Drink").price(200).available(true).build());
        em.flush();

        assertThat(menuRepository.findByAvailableTrueOrderByIdAsc())
                .extracting(Menu::getId)
                .containsExactly(ramen.getId(), drink.getId());
    }
}
