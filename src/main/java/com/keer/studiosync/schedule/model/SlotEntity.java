package com.keer.studiosync.schedule.model;

import com.keer.studiosync.reservation.model.EventSource;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalTime;

@Entity
@Table(name = "schedule_slot", indexes = @Index(name = "idx_schedule_slot_date", columnList = "slot_date"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SlotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "slot_date", nullable = false)
    private LocalDate date;

    @Column(name = "start_time", nullable = false)
    private LocalTime start;

    @Column(name = "end_time")
    private LocalTime end;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SlotType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EventSource source;

    private String customerName;

    private String resource;

    @Column(name = "slot_group", nullable = false)
    private int group;

    private String sender;

    @Column(length = 200)
    private String subject;

    private String messageId;

    private double confidence;

    public static SlotEntity from(LocalDate date, Slot slot) {
        SlotEntity entity = new SlotEntity();
        entity.setDate(date);
        entity.setStart(slot.getStart());
        entity.setEnd(slot.getEnd());
        entity.setType(slot.getType());
        entity.setSource(slot.getSource());
        entity.setCustomerName(slot.getCustomerName());
        entity.setResource(slot.getResource());
        entity.setGroup(slot.getGroup());
        entity.setSender(slot.getSender());
        entity.setSubject(slot.getSubject());
        entity.setMessageId(slot.getMessageId());
        entity.setConfidence(slot.getConfidence());
        return entity;
    }

    public Slot toSlot() {
        return Slot.builder()
                .start(start)
                .end(end)
                .type(type)
                .source(source)
                .customerName(customerName)
                .resource(resource)
                .group(group)
                .sender(sender)
                .subject(subject)
                .messageId(messageId)
                .confidence(confidence)
                .build();
    }
}
