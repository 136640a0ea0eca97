package net.findmycard.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.List;
import net.findmycard.exception.InvalidRequestException;
import net.findmycard.mapper.ScryfallCardMapper;
import net.findmycard.model.CardPrinting;
import net.findmycard.model.Legality;
import net.findmycard.repository.InMemoryCardPrintingRepository;
import net.findmycard.service.event.CatalogMutationEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class CatalogIngestionServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private InMemoryCardPrintingRepository repository;
    private CatalogIngestionService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryCardPrintingRepository();
        service = new CatalogIngestionService(repository, new ScryfallCardMapper(), eventPublisher, 2);
    }

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw);
    }

    @Test
    void should_StoreValidCardsAndAnnounceThem_When_Upserting() throws Exception {
        JsonNode cards = json("""
            [{"id":"p-shock","oracle_id":"o-shock","name":"Shock","type_line":"Instant","cmc":1,
              "colors":["R"],"color_identity":["R"],"set":"m19","rarity":"common",
              "prices":{"usd":"0.25"}},
             {"name":"No Id"}]
            """);

        IngestionResult result = service.upsertCards(cards, "test");

        assertThat(result).isEqualTo(new IngestionResult(2, 1, 1));
        assertThat(repository.findById("p-shock")).isPresent();
        ArgumentCaptor<CatalogMutationEvent> event = ArgumentCaptor.forClass(CatalogMutationEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().getKind()).isEqualTo(CatalogMutationEvent.Kind.UPSERT);
        assertThat(event.getValue().getPrintingIds()).containsExactly("p-shock");
    }

    @Test
    void should_RejectReimport_When_PayloadHasNoValidCard() throws Exception {
        repository.upsertAll(List.of(new ScryfallCardMapper()
            .toPrinting(json("{\"id\":\"p-keep\",\"name\":\"Keep\"}")).orElseThrow()));

        assertThatThrownBy(() -> service.reimportCards(json("[{\"name\":\"broken\"}]"), "test"))
            .isInstanceOf(InvalidRequestException.class);

        assertThat(repository.count()).isEqualTo(1);
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void should_ReplaceCatalog_When_Reimporting() throws Exception {
        service.upsertCards(json("[{\"id\":\"p-old\",\"name\":\"Old\"}]"), "seed");

        service.reimportCards(json("[{\"id\":\"p-new\",\"name\":\"New\"}]"), "test");

        assertThat(repository.findAll()).extracting(CardPrinting::printingId).containsExactly("p-new");
        ArgumentCaptor<CatalogMutationEvent> event = ArgumentCaptor.forClass(CatalogMutationEvent.class);
        verify(eventPublisher, times(2)).publishEvent(event.capture());
        assertThat(event.getValue().isFullReplace()).isTrue();
    }

    @Test
    void should_UpdateOnlyMarketData_When_RefreshingKnownPrintings() throws Exception {
        service.upsertCards(json("""
            [{"id":"p-bolt","name":"Lightning Bolt","oracle_text":"Deal 3.","prices":{"usd":"1.00"},
              "legalities":{"modern":"legal"}}]
            """), "seed");

        IngestionResult result = service.refreshMarketData(json("""
            [{"id":"p-bolt","name":"ignored","prices":{"usd":"2.50"},"legalities":{"modern":"banned"}},
             {"id":"p-unknown","prices":{"usd":"9.99"}}]
            """), "prices");

        CardPrinting bolt = repository.findById("p-bolt").orElseThrow();
        assertThat(result).isEqualTo(new IngestionResult(2, 1, 1));
        assertThat(bolt.name()).isEqualTo("Lightning Bolt");
        assertThat(bolt.oracleText()).isEqualTo("Deal 3.");
        assertThat(bolt.prices().usd()).isEqualByComparingTo(new BigDecimal("2.50"));
        assertThat(bolt.legalities()).containsEntry("modern", Legality.BANNED);
        assertThat(repository.findById("p-unknown")).isEmpty();
    }

    @Test
    void should_ImportInBatchesWithSingleEvent_When_Streaming() throws Exception {
        List<JsonNode> cards = List.of(
            json("{\"id\":\"p-1\",\"name\":\"One\"}"),
            json("{\"id\":\"p-2\",\"name\":\"Two\"}"),
            json("{\"id\":\"p-3\",\"name\":\"Three\"}"),
            json("{\"name\":\"Nameless id\"}"));

        IngestionResult result = service.importStream(cards.iterator(), "bulk");

        assertThat(result).isEqualTo(new IngestionResult(4, 3, 1));
        assertThat(repository.count()).isEqualTo(3);
        verify(eventPublisher, times(1)).publishEvent(any(CatalogMutationEvent.class));
    }

    @Test
    void should_RejectPayload_When_BodyIsNotAnArray() throws Exception {
        assertThatThrownBy(() -> service.upsertCards(json("{\"id\":\"p-1\"}"), "test"))
            .isInstanceOf(InvalidRequestException.class)
            .hasMessage("Expected a JSON array of card objects");
    }
}
