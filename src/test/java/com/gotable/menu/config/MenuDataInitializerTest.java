package com.gotable.menu.config;

import com.gotable.menu.entity.Menu;
import com.gotable.menu.repository.MenuRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MenuDataInitializerTest {

    @Mock
    private MenuRepository menuRepository;

    @InjectMocks
    private MenuDataInitializer initializer;

    @Test
    @DisplayName("카탈로그가 비어 있으면 기본 메뉴 4종을 등록")
    @SuppressWarnings("unchecked")
    void run_SeedsEmptyCatalog() {
        given(menuRepository.count()).willReturn(0L);

        initializer.run(null);

        ArgumentCaptor<List<Menu>> menus = ArgumentCaptor.forClass(List.class);
        verify(menuRepository).saveAll(menus.capture());
        assertThat(menus.getValue())
                .extracting(Menu::getPrice)
                .containsExactly(850, 750, 550, 200);
        assertThat(menus.getValue()).allMatch(Menu::isAvailable);
    }

    @Test
    @DisplayName("이미 메뉴가 있으면 아무것도 하지 않음")
    void run_SkipsPopulatedCatalog() {
        given(menuRepository.count()).willReturn(4L);

        initializer.run(null);

        verify(menuRepository, never()).saveAll(anyList());
    }
}
