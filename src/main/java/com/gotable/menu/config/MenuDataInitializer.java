package com.gotable.menu.config;

import com.gotable.menu.entity.Menu;
import com.gotable.menu.repository.MenuRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 기동 시 메뉴 초기 데이터 적재.
 *
 * <p>카탈로그가 비어 있을 때만 대표 메뉴 4종을 넣는다.
 * {@code gotable.catalog.seed-on-startup=false}면 빈으로 등록되지 않는다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "gotable.catalog.seed-on-startup", havingValue = "true", matchIfMissing = true)
public class MenuDataInitializer implements ApplicationRunner {

    private final MenuRepository menuRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (menuRepository.count() > 0) {
            log.info("Menu catalog already populated, skipping seed");
            return;
        }

        List<Menu> menus = List.of(
                menu("Signature Ramen",
                        "Slow-simmered rich broth with house noodles, chashu, seasoned egg and scallions.",
                        850, "images/ramen.png"),
                menu("Special Rice Bowl",
                        "A generous bowl of rice piled high with toppings.",
                        750, "images/don.png"),
                menu("Karaage",
                        "Juicy, crispy fried chicken marinated in our secret sauce.",
                        550, "images/karaage.png"),
                menu("Drink",
                        "Cola, orange juice, tea and more.",
                        200, "images/cola.png"));

        menuRepository.saveAll(menus);
        log.info("Menu catalog seeded: {} menus", menus.size());
    }

    private Menu menu(String name, String description, int price, String imageUrl) {
        return Menu.builder()
                .name(name)
                .description(description)
                .price(price)
                .imageUrl(imageUrl)
                .available(true)
                .build();
    }
}
